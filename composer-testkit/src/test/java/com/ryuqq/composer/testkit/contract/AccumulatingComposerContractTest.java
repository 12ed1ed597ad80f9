package com.ryuqq.composer.testkit.contract;

import com.ryuqq.composer.core.composer.AroundScope;
import com.ryuqq.composer.core.composer.AccumulatingComposer;
import com.ryuqq.composer.core.error.UnproducedParameterException;
import com.ryuqq.composer.core.model.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the accumulating composer.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Second of three units fails → merged result unsuccessful, third never invoked</li>
 *   <li>Unproduced required input → error lists exactly the missing key, no unit invoked</li>
 *   <li>Messages accumulate in execution order</li>
 *   <li>Inputs pass through to the merged result</li>
 *   <li>Identity around scope → same result as no scope</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
class AccumulatingComposerContractTest extends AbstractComposerTest {

    @Test
    void testShortCircuit_WhenMiddleUnitFails_ThirdNeverInvoked() {
        // Given
        RecordingUnit first = RecordingUnit.named("First").build();
        RecordingUnit second = RecordingUnit.named("Second").failsWith("declined").build();
        RecordingUnit third = RecordingUnit.named("Third").build();
        AccumulatingComposer composer = AccumulatingComposer.create(b -> b.add(first).add(second).add(third));

        // When
        Outcome outcome = composer.call(Map.of());

        // Then
        assertFailedWith(outcome, "declined");
        assertTrue(first.wasInvoked());
        assertTrue(second.wasInvoked());
        assertFalse(third.wasInvoked(), "Third unit must not run after a failure");
    }

    @Test
    void testStaticFeasibility_UnproducedKeyReportedBeforeAnyInvocation() {
        // Given
        RecordingUnit producer = RecordingUnit.named("ProduceFoo").produces("foo", 1).build();
        RecordingUnit consumer = RecordingUnit.named("ConsumeFooBar").requires("foo", "bar").build();
        AccumulatingComposer composer = AccumulatingComposer.create(b -> b.add(producer).add(consumer));

        // When
        UnproducedParameterException exception = assertThrows(UnproducedParameterException.class,
                () -> composer.call(Map.of()));

        // Then
        assertEquals(List.of("bar"), exception.getUnproducedKeys());
        assertEquals("ConsumeFooBar", exception.getUnitName());
        assertFalse(producer.wasInvoked());
        assertFalse(consumer.wasInvoked());
        assertDiagnosticLines(0);
    }

    @Test
    void testMessageAccumulation_PreservesAppendOrder() {
        // Given
        RecordingUnit a = RecordingUnit.named("A").emits("m1").build();
        RecordingUnit b = RecordingUnit.named("B").emits("m2", "m3").build();

        // When
        Outcome outcome = AccumulatingComposer.create(builder -> builder.add(a).add(b)).call(Map.of());

        // Then
        assertTrue(outcome.isSuccessful());
        assertEquals(List.of("m1", "m2", "m3"), outcome.messages());
    }

    @Test
    void testPassthrough_InputsAndOutputsMerged() {
        // Given
        RecordingUnit createUser = RecordingUnit.named("CreateUser").requires("email").produces("user", "u-1").build();
        RecordingUnit createAccount = RecordingUnit.named("CreateAccount").requires("user").produces("account", "acc-1").build();

        // When
        Outcome outcome = AccumulatingComposer.create(b -> b.add(createUser).add(createAccount))
                .call(Map.of("email", "a@b.c"));

        // Then
        assertSuccessful(outcome);
        assertValues(outcome, Map.of("email", "a@b.c", "user", "u-1", "account", "acc-1"));
        assertEquals("u-1", createAccount.invocations().get(0).get("user"));
    }

    @Test
    void testIdentityAroundScope_SameResultAsNoScope() {
        // Given
        RecordingUnit first = RecordingUnit.named("First").produces("a", 1).emits("m1").build();
        RecordingUnit second = RecordingUnit.named("Second").requires("a").failsWith("nope").build();

        // When
        Outcome plain = AccumulatingComposer.create(b -> b.add(first).add(second)).call(Map.of("x", 0));
        Outcome wrapped = AccumulatingComposer.create(b -> b.add(first).add(second).around(AroundScope.identity()))
                .call(Map.of("x", 0));

        // Then
        assertEquals(plain, wrapped);
    }
}
