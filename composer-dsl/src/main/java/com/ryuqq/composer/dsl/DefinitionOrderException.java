package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.error.ComposerException;

/**
 * {@link UnitCatalog#unit(UnitOptions)} 없이 {@code precondition} 또는 {@code define}을 호출한 경우.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class DefinitionOrderException extends ComposerException {

    public DefinitionOrderException(String operation) {
        super("`" + operation + "` must be invoked after `unit` and before the unit is defined");
    }
}
