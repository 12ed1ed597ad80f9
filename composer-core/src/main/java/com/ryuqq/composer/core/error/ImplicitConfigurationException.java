package com.ryuqq.composer.core.error;

/**
 * 입력/결과 계약이 명시적으로 선언되지 않은 Unit을 호출한 경우.
 *
 * <p>빈 계약도 {@code noParams()} / {@code noResults()}로 명시해야 합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class ImplicitConfigurationException extends ComposerException {

    private final String unitName;

    /**
     * 생성자.
     *
     * @param unitName 계약이 누락된 Unit 이름
     */
    public ImplicitConfigurationException(String unitName) {
        super("Params and result of " + unitName + " must be explicitly configured! "
            + "Either call params(...) or noParams() / results(...) or noResults()");
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }
}
