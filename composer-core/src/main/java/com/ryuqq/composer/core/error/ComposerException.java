package com.ryuqq.composer.core.error;

/**
 * 구성(configuration) 오류의 최상위 예외.
 *
 * <p>도메인 실패는 예외가 아니라 {@link com.ryuqq.composer.core.model.Outcome}의
 * {@code successful=false}로 표현됩니다. 이 계층의 예외는 잘못된 선언이나
 * 잘못된 조합처럼 호출자가 코드로 고쳐야 하는 문제만 나타냅니다.</p>
 *
 * <p><strong>하위 예외:</strong></p>
 * <ul>
 *   <li>{@link ImplicitConfigurationException} - 계약 미선언</li>
 *   <li>{@link ReservedParameterException} - 예약 키 입력</li>
 *   <li>{@link UnproducedParameterException} - 선행 Unit이 만들지 않는 필수 입력</li>
 *   <li>{@link UnknownRequirementException} - 알 수 없는 requirement 문자열</li>
 *   <li>{@link FailureException} - strict 호출의 도메인 실패 변환</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class ComposerException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public ComposerException(String message) {
        super(message);
    }
}
