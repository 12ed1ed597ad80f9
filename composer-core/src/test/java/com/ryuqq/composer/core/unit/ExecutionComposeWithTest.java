package com.ryuqq.composer.core.unit;

import com.ryuqq.composer.core.diagnostics.Diagnostics;
import com.ryuqq.composer.core.model.Outcome;
import com.ryuqq.composer.core.support.TestUnits;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 내부 누적 합성(composeWith) 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class ExecutionComposeWithTest {

    private final Unit lookupUser = TestUnits.of("LookupUser",
        c -> c.requiredParams("userId").results("user", "audit"),
        execution -> {
            execution.addMessage("user found");
            execution.set("user", "user-" + execution.param("userId"));
            execution.set("audit", "lookup");
            return execution.done();
        });

    private final Unit rejectUser = TestUnits.of("RejectUser",
        c -> c.requiredParams("user").noResults(),
        execution -> execution.die("user rejected"));

    @Test
    void composeWith_선언된_결과만_병합하고_메시지는_모두_추가() {
        // given
        Unit register = TestUnits.of("Register",
            c -> c.requiredParams("userId").results("user"),
            execution -> {
                execution.addMessage("registering");
                execution.composeWith(Map.of("userId", execution.param("userId")), b -> b.add(lookupUser));
                return execution.done();
            });

        // when
        Outcome outcome = Diagnostics.silence(() -> register.call(Map.of("userId", 7)));

        // then
        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.get("user")).isEqualTo("user-7");
        assertThat(outcome.containsKey("audit")).isFalse();
        assertThat(outcome.containsKey("userId")).isFalse();
        assertThat(outcome.messages()).containsExactly("registering", "user found");
    }

    @Test
    void composeWith_하위_실패시_successful과_메시지_반영() {
        // given
        AtomicReference<Outcome> subOutcome = new AtomicReference<>();
        Unit register = TestUnits.of("Register",
            c -> c.requiredParams("userId").results("user"),
            execution -> {
                subOutcome.set(execution.composeWith(Map.of("userId", 1), b -> b.add(lookupUser).add(rejectUser)));
                return execution.done();
            });

        // when
        Outcome outcome = Diagnostics.silence(() -> register.call(Map.of("userId", 1)));

        // then
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.messages()).containsExactly("user found", "user rejected");
        assertThat(outcome.get("user")).isEqualTo("user-1");
        assertThat(subOutcome.get().get("audit")).isEqualTo("lookup");
    }

    @Test
    void composeWith_null값_결과는_병합하지_않음() {
        // given
        Unit producesNull = TestUnits.of("ProducesNull",
            c -> c.noParams().results("user"),
            execution -> {
                execution.set("user", null);
                return execution.done();
            });
        Unit caller = TestUnits.of("Caller",
            c -> c.noParams().results("user"),
            execution -> {
                execution.composeWith(Map.of(), b -> b.add(producesNull));
                return execution.done();
            });

        // when
        Outcome outcome = Diagnostics.silence(() -> caller.call(Map.of()));

        // then
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.messages()).containsExactly("Unit implementation did not set required result: user");
    }
}
