package io.lattice.core.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ExecutionErrorTest {

    @Test
    void shouldDeriveCopiesWithoutChangingOriginal() {
        // Given
        ExecutionError original = ExecutionError.of("failed", "CODE");

        // When
        ExecutionError extended = original.withExtension("retry", false).withCode("OTHER");

        // Then
        assertThat(original.extensions()).isEmpty();
        assertThat(original.code()).isEqualTo("CODE");
        assertThat(extended.extensions()).containsEntry("retry", false);
        assertThat(extended.code()).isEqualTo("OTHER");
        assertThat(extended.path()).isEmpty();
    }

    @Test
    void shouldRequireMessage() {
        assertThatThrownBy(() -> ExecutionError.of(null, "CODE"))
                .isInstanceOf(NullPointerException.class);
    }
}
