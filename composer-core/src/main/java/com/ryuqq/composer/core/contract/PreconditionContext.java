package com.ryuqq.composer.core.contract;

import com.ryuqq.composer.core.model.Params;

/**
 * precondition이 평가 시점에 볼 수 있는 호출 정보.
 *
 * <p>precondition은 바인딩된 입력을 읽고, 건너뛴 이유 등을 메시지로 남길 수 있습니다.
 * 결과 값은 설정할 수 없습니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public interface PreconditionContext {

    /**
     * 바인딩된 입력.
     *
     * @return 입력
     */
    Params params();

    /**
     * 메시지 추가 ({@code successful}은 변경하지 않음).
     *
     * @param message 메시지
     */
    void addMessage(String message);
}
