package io.lattice.core.options;

import static org.assertj.core.api.Assertions.assertThat;

import io.lattice.core.concurrent.CancellationToken;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExecutorSettingsTest {

    @Test
    void shouldApplyOnlyPresentSettings() {
        // Given
        ExecutorOptions options = new ExecutorOptions().setQueryCacheSize(250);
        ExecutorSettings settings =
                ExecutorSettings.builder()
                        .executionTimeout(Duration.ofSeconds(10))
                        .contextData(Map.of("tenant", "acme"))
                        .build();

        // When
        settings.applyTo(options);

        // Then
        assertThat(options.getExecutionTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(options.getQueryCacheSize()).isEqualTo(250);
        assertThat(options.isIncludeExceptionDetails()).isFalse();
        assertThat(options.getContextData()).containsEntry("tenant", "acme");
    }

    @Test
    void shouldApplyThroughConfigureAction() {
        // Given
        ExecutorSettings settings =
                ExecutorSettings.builder().includeExceptionDetails(true).queryCacheSize(5).build();

        // When
        ExecutorOptions options =
                ExecutorOptionsAssembler.resolve(
                        null, List.of(settings.toAction()), CancellationToken.NONE);

        // Then
        assertThat(options.isIncludeExceptionDetails()).isTrue();
        assertThat(options.getQueryCacheSize()).isEqualTo(ExecutorOptions.MIN_QUERY_CACHE_SIZE);
    }

    @Test
    void shouldCompareByValue() {
        // Given
        ExecutorSettings first =
                ExecutorSettings.builder().executionTimeout(Duration.ofSeconds(1)).build();
        ExecutorSettings same =
                ExecutorSettings.builder().executionTimeout(Duration.ofSeconds(1)).build();
        ExecutorSettings other =
                ExecutorSettings.builder().executionTimeout(Duration.ofSeconds(2)).build();

        // Then
        assertThat(first).isEqualTo(same).hasSameHashCodeAs(same).isNotEqualTo(other);
        assertThat(first.toAction()).isNotEqualTo(same.toAction());
    }

    @Test
    void shouldTreatNullContextDataAsEmpty() {
        assertThat(ExecutorSettings.builder().contextData(null).build().getContextData()).isEmpty();
    }
}
