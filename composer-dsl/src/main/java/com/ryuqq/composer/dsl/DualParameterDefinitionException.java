package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.error.ComposerException;

/**
 * 입력 키를 {@link UnitOptions#params()}와 입력 record 컴포넌트 양쪽으로 선언한 경우.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class DualParameterDefinitionException extends ComposerException {

    private final String unitName;

    /**
     * 생성자.
     *
     * @param unitName 정의 중인 Unit 이름
     */
    public DualParameterDefinitionException(String unitName) {
        super("Definition for " + unitName + " attempts to define param keys both via unit options and "
            + "record components. Only one form is allowed");
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }
}
