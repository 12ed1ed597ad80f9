package com.ryuqq.composer.core.error;

/**
 * 예약 키({@code successful}, {@code messages})가 누적 합성기의 입력으로 들어온 경우.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class ReservedParameterException extends ComposerException {

    private final String paramName;

    /**
     * 생성자.
     *
     * @param paramName 허용되지 않은 입력 키
     */
    public ReservedParameterException(String paramName) {
        super("incoming parameter not allowed: " + paramName);
        this.paramName = paramName;
    }

    public String getParamName() {
        return paramName;
    }
}
