package com.ryuqq.composer.core.contract;

import com.ryuqq.composer.core.error.UnknownRequirementException;

import java.util.Locale;

/**
 * 입력 키의 필수 여부.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public enum Requirement {

    /** 호출 시 반드시 바인딩되어야 함 */
    REQUIRED,

    /** 바인딩되지 않아도 됨 */
    OPTIONAL;

    /**
     * 문자열 requirement 파싱 ({@code "required"}, {@code "optional"}, 대소문자 무시).
     *
     * @param value requirement 문자열
     * @return Requirement
     * @throws UnknownRequirementException 알 수 없는 값인 경우
     */
    public static Requirement parse(String value) {
        if (value == null) {
            throw new UnknownRequirementException("null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "required" -> REQUIRED;
            case "optional" -> OPTIONAL;
            default -> throw new UnknownRequirementException(value);
        };
    }
}
