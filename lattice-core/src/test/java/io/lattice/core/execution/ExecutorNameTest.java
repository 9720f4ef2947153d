package io.lattice.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ExecutorNameTest {

    @Test
    void shouldCompareByValue() {
        assertThat(ExecutorName.of("catalog")).isEqualTo(new ExecutorName("catalog"));
        assertThat(ExecutorName.of("catalog")).isNotEqualTo(ExecutorName.of("Catalog"));
        assertThat(ExecutorName.of("catalog")).hasToString("catalog");
    }

    @Test
    void shouldFallBackToDefault() {
        assertThat(ExecutorName.of(null)).isSameAs(ExecutorName.DEFAULT);
        assertThat(ExecutorName.of(" ")).isSameAs(ExecutorName.DEFAULT);
        assertThat(ExecutorName.orDefault(null)).isSameAs(ExecutorName.DEFAULT);
    }

    @Test
    void shouldRejectBlankValue() {
        assertThatThrownBy(() -> new ExecutorName("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExecutorName(null)).isInstanceOf(NullPointerException.class);
    }
}
