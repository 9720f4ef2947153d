package io.lattice.core.options;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lattice.core.error.ErrorFilterFactory;
import io.lattice.core.execution.pipeline.RequestMiddleware;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExecutorFactoryOptionsTest {

    @Test
    void shouldBeEmptyByDefault() {
        ExecutorFactoryOptions options = ExecutorFactoryOptions.empty();

        assertThat(options.getSchema()).isEmpty();
        assertThat(options.getSchemaBuilder()).isEmpty();
        assertThat(options.getExecutorOptions()).isEmpty();
        assertThat(options.getSchemaBuilderActions()).isEmpty();
        assertThat(options.getExecutorOptionsActions()).isEmpty();
        assertThat(options.getPipeline()).isEmpty();
        assertThat(options.getErrorFilters()).isEmpty();
    }

    @Test
    void shouldReproduceItselfThroughToBuilder() {
        // Given
        RequestMiddleware middleware = (context, next) -> next;
        ErrorFilterFactory filter = (services, options) -> error -> error;
        ExecutorFactoryOptions original =
                ExecutorFactoryOptions.builder()
                        .executorOptions(new ExecutorOptions())
                        .addMiddleware(middleware)
                        .addErrorFilter(filter)
                        .build();

        // When
        ExecutorFactoryOptions copy = original.toBuilder().build();

        // Then
        assertThat(copy.getExecutorOptions()).containsSame(original.getExecutorOptions().get());
        assertThat(copy.getPipeline()).containsExactly(middleware);
        assertThat(copy.getErrorFilters()).containsExactly(filter);
    }

    @Test
    void shouldReplacePipeline() {
        // Given
        RequestMiddleware first = (context, next) -> next;
        RequestMiddleware second = (context, next) -> next;

        // When
        ExecutorFactoryOptions options =
                ExecutorFactoryOptions.builder()
                        .addMiddleware(first)
                        .pipeline(List.of(second))
                        .build();

        // Then
        assertThat(options.getPipeline()).containsExactly(second);
    }

    @Test
    void shouldExposeUnmodifiableLists() {
        ExecutorFactoryOptions options = ExecutorFactoryOptions.builder().build();

        assertThatThrownBy(() -> options.getPipeline().add((context, next) -> next))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
