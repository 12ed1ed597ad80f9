package com.ryuqq.composer.core.error;

/**
 * 문자열로 선언된 파라미터 requirement가 {@code required}/{@code optional} 중 하나가 아닌 경우.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class UnknownRequirementException extends ComposerException {

    /**
     * 생성자.
     *
     * @param value 알 수 없는 requirement 값
     */
    public UnknownRequirementException(String value) {
        super("Unknown parameter configuration: " + value + ". Must be one of required, optional");
    }
}
