package com.ryuqq.composer.testkit.contract;

import com.ryuqq.composer.core.contract.ContractBuilder;
import com.ryuqq.composer.core.model.Outcome;
import com.ryuqq.composer.core.unit.Completion;
import com.ryuqq.composer.core.unit.Execution;
import com.ryuqq.composer.core.unit.Unit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for sub-composition from within a unit body.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Successful sub-chain → only the caller's declared outputs are merged, messages folded in</li>
 *   <li>Failed sub-chain → caller is unsuccessful and still carries the sub-chain messages</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
class SubCompositionContractTest extends AbstractComposerTest {

    private static Unit caller(RecordingUnit... steps) {
        return new Unit() {
            @Override
            public String name() {
                return "Onboard";
            }

            @Override
            protected void configure(ContractBuilder contract) {
                contract.requiredParams("email").results("user");
            }

            @Override
            protected Completion perform(Execution execution) {
                execution.addMessage("onboarding");
                execution.composeWith(Map.of("email", execution.param("email")), b -> {
                    for (RecordingUnit step : steps) {
                        b.add(step);
                    }
                });
                return execution.done();
            }
        };
    }

    @Test
    void testSuccessfulSubChain_MergesOnlyDeclaredOutputs() {
        // Given
        RecordingUnit createUser = RecordingUnit.named("CreateUser").requires("email")
                .produces("user", "u-1").produces("internalId", 99).emits("user created").build();

        // When
        Outcome outcome = caller(createUser).call(Map.of("email", "a@b.c"));

        // Then
        assertTrue(outcome.isSuccessful());
        assertValues(outcome, Map.of("user", "u-1"));
        assertEquals(List.of("onboarding", "user created"), outcome.messages());
    }

    @Test
    void testFailedSubChain_FoldsMessagesAndFails() {
        // Given
        RecordingUnit createUser = RecordingUnit.named("CreateUser").requires("email").produces("user", "u-1").build();
        RecordingUnit verify = RecordingUnit.named("Verify").requires("user").failsWith("email bounced").build();

        // When
        Outcome outcome = caller(createUser, verify).call(Map.of("email", "a@b.c"));

        // Then
        assertFalse(outcome.isSuccessful());
        assertEquals(List.of("onboarding", "email bounced"), outcome.messages());
    }
}
