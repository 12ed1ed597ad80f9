package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.contract.ContractBuilder;
import com.ryuqq.composer.core.contract.Requirement;
import com.ryuqq.composer.core.unit.Completion;
import com.ryuqq.composer.core.unit.Execution;
import com.ryuqq.composer.core.unit.Unit;

import java.util.Map;

/**
 * {@link UnitCatalog}가 만든 Unit.
 *
 * <p>계약은 {@link ContractBuilder}로 직접 선언한 Unit과 같습니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
final class DefinedUnit extends Unit {

    private final String name;
    private final Map<String, Requirement> params;
    private final UnitOptions options;
    private final UnitBody body;

    DefinedUnit(String name, Map<String, Requirement> params, UnitOptions options, UnitBody body) {
        this.name = name;
        this.params = params;
        this.options = options;
        this.body = body;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    protected void configure(ContractBuilder contract) {
        if (params.isEmpty()) {
            contract.noParams();
        } else {
            contract.params(params);
        }
        if (options.results().isEmpty()) {
            contract.noResults();
        } else {
            contract.results(options.results().toArray(new String[0]));
        }
        if (options.hasPrecondition()) {
            contract.precondition(options.preconditionName(), options.precondition());
        }
    }

    @Override
    protected Completion perform(Execution execution) {
        return body.perform(execution);
    }
}
