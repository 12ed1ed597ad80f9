package com.ryuqq.composer.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParamsTest {

    @Test
    void has_NullValue_IsBound() {
        // Given
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("note", null);

        // When
        Params params = Params.of(raw);

        // Then
        assertThat(params.has("note")).isTrue();
        assertThat(params.get("note")).isNull();
        assertThat(params.getOrDefault("note", "x")).isNull();
        assertThat(params.getOrDefault("other", "x")).isEqualTo("x");
    }

    @Test
    void of_Null_ReturnsEmpty() {
        assertThat(Params.of(null)).isSameAs(Params.empty());
    }

    @Test
    void of_NullKey_ThrowsException() {
        Map<String, Object> raw = new HashMap<>();
        raw.put(null, 1);

        assertThatThrownBy(() -> Params.of(raw))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("param keys cannot be null");
    }

    @Test
    void of_CopiesInput() {
        // Given
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("a", 1);
        Params params = Params.of(raw);

        // When
        raw.put("b", 2);

        // Then
        assertThat(params.keys()).containsExactly("a");
        assertThat(params.get("a", Integer.class)).isEqualTo(1);
    }
}
