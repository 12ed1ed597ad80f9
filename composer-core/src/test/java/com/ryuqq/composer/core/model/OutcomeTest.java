package com.ryuqq.composer.core.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Outcome 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void success_ReservedKeysOnly() {
        // When
        Outcome outcome = Outcome.success();

        // Then
        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.messages()).isEmpty();
        assertThat(outcome.keys()).containsExactly(Outcome.SUCCESSFUL, Outcome.MESSAGES);
        assertThat(outcome.isSkipped()).isFalse();
    }

    @Test
    void skipped_SuccessfulAndSkipped() {
        // When
        Outcome outcome = Outcome.skipped();

        // Then
        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.isSkipped()).isTrue();
        assertThat(outcome.messages()).isEmpty();
    }

    @Test
    void of_MissingSuccessful_TreatedAsFailure() {
        // When
        Outcome outcome = Outcome.of(Map.of("user", "kim"));

        // Then
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.get("user")).isEqualTo("kim");
    }

    @Test
    void of_NullValue_KeyIsKept() {
        // Given
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(Outcome.SUCCESSFUL, true);
        entries.put("user", null);

        // When
        Outcome outcome = Outcome.of(entries);

        // Then
        assertThat(outcome.containsKey("user")).isTrue();
        assertThat(outcome.get("user")).isNull();
    }

    @Test
    void values_ExcludesReservedKeys() {
        // Given
        Outcome outcome = Outcome.of(Map.of(Outcome.SUCCESSFUL, true, Outcome.MESSAGES, List.of("m1"), "total", 3));

        // Then
        assertThat(outcome.values()).containsOnlyKeys("total");
        assertThat(outcome.asMap()).containsKeys(Outcome.SUCCESSFUL, Outcome.MESSAGES, "total");
    }

    @Test
    void of_MessagesNotCollection_ThrowsException() {
        assertThatThrownBy(() -> Outcome.of(Map.of(Outcome.MESSAGES, "oops")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("messages must be a collection");
    }

    @Test
    void asMap_IsImmutable() {
        Outcome outcome = Outcome.success();

        assertThatThrownBy(() -> outcome.asMap().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
