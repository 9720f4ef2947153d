package io.lattice.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class LatticeConfigTest {

    @Test
    void shouldUseDefaults() {
        LatticeConfig config = new LatticeConfig();

        assertThat(config.getThreadPoolSize()).isEqualTo(4);
        assertThat(config.getBuildLockPollInterval()).isEqualTo(Duration.ofMillis(25));
        assertThat(config.isLogDiagnostics()).isTrue();
    }

    @Test
    void shouldBuildFluently() {
        // When
        LatticeConfig config =
                LatticeConfig.builder()
                        .threadPoolSize(2)
                        .buildLockPollInterval(Duration.ofMillis(10))
                        .logDiagnostics(false)
                        .build();

        // Then
        assertThat(config.getThreadPoolSize()).isEqualTo(2);
        assertThat(config.getBuildLockPollInterval()).isEqualTo(Duration.ofMillis(10));
        assertThat(config.isLogDiagnostics()).isFalse();
    }

    @Test
    void shouldRejectInvalidValues() {
        LatticeConfig config = new LatticeConfig();

        assertThatThrownBy(() -> config.setThreadPoolSize(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.setBuildLockPollInterval(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
