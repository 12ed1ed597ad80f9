package com.ryuqq.composer.testkit.contract;

import com.ryuqq.composer.core.contract.ContractBuilder;
import com.ryuqq.composer.core.contract.Requirement;
import com.ryuqq.composer.core.model.Params;
import com.ryuqq.composer.core.unit.Completion;
import com.ryuqq.composer.core.unit.Execution;
import com.ryuqq.composer.core.unit.Unit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Configurable Unit that records every body invocation.
 *
 * <p>The body adds the configured messages, sets the configured outputs and then either
 * finishes normally or aborts with the configured failure messages. The params seen by
 * each body run are kept for later assertions; a run rejected before the body
 * (missing required input, false precondition) is not recorded.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingUnit createUser = RecordingUnit.named("CreateUser")
 *     .requires("email")
 *     .produces("user", "u-1")
 *     .build();
 *
 * createUser.call(Map.of("email", "a@b.c"));
 * assertEquals(1, createUser.invocationCount());
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class RecordingUnit extends Unit {

    private final String name;
    private final Map<String, Requirement> params;
    private final Map<String, Object> outputs;
    private final List<String> messages;
    private final List<String> failures;
    private final List<Params> invocations = new CopyOnWriteArrayList<>();

    private RecordingUnit(Builder builder) {
        this.name = builder.name;
        this.params = new LinkedHashMap<>(builder.params);
        this.outputs = new LinkedHashMap<>(builder.outputs);
        this.messages = List.copyOf(builder.messages);
        this.failures = builder.failures == null ? null : List.copyOf(builder.failures);
    }

    /**
     * Starts building a recording unit.
     *
     * @param name unit name used in diagnostics
     * @return a new builder
     */
    public static Builder named(String name) {
        return new Builder(name);
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
        if (outputs.isEmpty()) {
            contract.noResults();
        } else {
            contract.results(outputs.keySet().toArray(new String[0]));
        }
    }

    @Override
    protected Completion perform(Execution execution) {
        invocations.add(execution.params());
        execution.addMessages(messages);
        outputs.forEach(execution::set);
        if (failures != null) {
            return execution.die(failures);
        }
        return execution.done();
    }

    public int invocationCount() {
        return invocations.size();
    }

    public boolean wasInvoked() {
        return !invocations.isEmpty();
    }

    /**
     * Returns the params of every body run in order.
     *
     * @return immutable snapshot
     */
    public List<Params> invocations() {
        return List.copyOf(invocations);
    }

    /**
     * Builder for RecordingUnit.
     */
    public static final class Builder {

        private final String name;
        private final Map<String, Requirement> params = new LinkedHashMap<>();
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private final List<String> messages = new ArrayList<>();
        private List<String> failures;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
        }

        public Builder requires(String... keys) {
            for (String key : keys) {
                params.put(key, Requirement.REQUIRED);
            }
            return this;
        }

        public Builder accepts(String... keys) {
            for (String key : keys) {
                params.put(key, Requirement.OPTIONAL);
            }
            return this;
        }

        /**
         * Declares an output and the value the body sets for it.
         *
         * @param key output key
         * @param value value set on every run
         * @return this
         */
        public Builder produces(String key, Object value) {
            outputs.put(key, value);
            return this;
        }

        public Builder emits(String... added) {
            messages.addAll(List.of(added));
            return this;
        }

        /**
         * Makes the body abort after setting outputs.
         *
         * @param reasons failure messages
         * @return this
         */
        public Builder failsWith(String... reasons) {
            this.failures = List.of(reasons);
            return this;
        }

        public RecordingUnit build() {
            return new RecordingUnit(this);
        }
    }
}
