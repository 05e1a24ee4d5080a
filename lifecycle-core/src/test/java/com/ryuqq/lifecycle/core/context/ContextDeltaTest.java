package com.ryuqq.lifecycle.core.context;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ContextDelta / ContextKey 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class ContextDeltaTest {

    private static final ContextKey<Long> LATENCY = ContextKey.of("latency", Long.class);

    @Test
    void builder_LastValueForSameKeyWins() {
        // when
        ContextDelta delta = ContextDelta.builder()
            .set(LATENCY, 10L)
            .set(LATENCY, 40L)
            .build();

        // then
        assertThat(MachineContext.of(delta).get(LATENCY)).isEqualTo(40L);
    }

    @Test
    void builder_NoUpdates_ReturnsEmptyDelta() {
        assertThat(ContextDelta.builder().build()).isSameAs(ContextDelta.empty());
        assertThat(ContextDelta.empty().isEmpty()).isTrue();
    }

    @Test
    void set_NullKey_ThrowsException() {
        assertThatThrownBy(() -> ContextDelta.builder().set(null, "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key cannot be null");
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Test
    void set_WrongValueType_ThrowsException() {
        // given: raw key로 타입 검사를 우회
        ContextKey raw = LATENCY;

        // when & then
        assertThatThrownBy(() -> ContextDelta.builder().set(raw, "forty"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("latency")
            .hasMessageContaining("Long");
    }

    @Test
    void contains_ReportsOnlyUpdatedKeys() {
        ContextDelta delta = ContextDelta.of(LATENCY, null);

        assertThat(delta.contains(LATENCY)).isTrue();
        assertThat(delta.contains(ContextKey.of("other", String.class))).isFalse();
    }

    @Test
    void contextKey_EqualityIsByNameAndType() {
        assertThat(ContextKey.of("latency", Long.class)).isEqualTo(LATENCY);
        assertThat(ContextKey.of("latency", Long.class).hashCode()).isEqualTo(LATENCY.hashCode());
        assertThat(ContextKey.of("latency", String.class)).isNotEqualTo(LATENCY);
    }

    @Test
    void set_SameNameWithDifferentType_ThrowsException() {
        // given
        ContextKey<String> latencyText = ContextKey.of("latency", String.class);
        ContextDelta.Builder builder = ContextDelta.builder().set(LATENCY, 40L);

        // when & then
        assertThatThrownBy(() -> builder.set(latencyText, "40ms"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'latency' is already bound to Long");
    }

    @Test
    void contextKey_BlankName_ThrowsException() {
        assertThatThrownBy(() -> ContextKey.of(" ", String.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or blank");
    }
}
