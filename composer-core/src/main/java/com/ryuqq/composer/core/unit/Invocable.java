package com.ryuqq.composer.core.unit;

import com.ryuqq.composer.core.contract.Contract;
import com.ryuqq.composer.core.error.FailureException;
import com.ryuqq.composer.core.model.Outcome;

import java.util.Map;

/**
 * 합성기에 등록할 수 있는 호출 단위.
 *
 * <p>{@link Unit}이 대표 구현이며, 같은 계약을 지키는 다른 구현도 등록할 수 있습니다.</p>
 *
 * <p><strong>호출 규칙:</strong></p>
 * <ul>
 *   <li>{@link #call(Map)} - lenient. 도메인 실패는 {@code successful=false}로 반환, 예외 없음</li>
 *   <li>{@link #callStrict(Map)} - strict. 실패 시 {@link FailureException} 발생</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public interface Invocable {

    /**
     * 진단 로그와 오류 메시지에 쓰이는 이름.
     *
     * @return 이름
     */
    String name();

    /**
     * 입력/결과 계약.
     *
     * @return Contract
     * @throws com.ryuqq.composer.core.error.ImplicitConfigurationException 계약이 선언되지 않은 경우
     */
    Contract contract();

    /**
     * lenient 호출.
     *
     * @param inputs 바인딩할 입력
     * @return 호출 결과
     */
    Outcome call(Map<String, ?> inputs);

    /**
     * strict 호출.
     *
     * @param inputs 바인딩할 입력
     * @return 성공한 호출 결과
     * @throws FailureException 결과가 실패인 경우 (메시지 목록 포함)
     */
    default Outcome callStrict(Map<String, ?> inputs) {
        Outcome outcome = call(inputs);
        if (!outcome.isSuccessful()) {
            throw new FailureException(name(), outcome.messages());
        }
        return outcome;
    }
}
