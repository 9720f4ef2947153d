package io.lattice.core.execution.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.error.DefaultErrorHandler;
import io.lattice.core.error.ErrorCodes;
import io.lattice.core.error.ErrorHandler;
import io.lattice.core.error.ExecutionError;
import io.lattice.core.execution.ExecutorName;
import io.lattice.core.execution.QueryRequest;
import io.lattice.core.execution.RequestContext;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.schema.SchemaBuilder;
import io.lattice.core.service.DefaultActivator;
import io.lattice.core.service.ServiceProvider;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExceptionMiddlewareTest {

    private MiddlewareFactoryContext factoryContext;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        ExecutorOptions options = new ExecutorOptions();
        ErrorHandler errorHandler = new DefaultErrorHandler(List.of(), options);
        factoryContext =
                new MiddlewareFactoryContext(
                        ExecutorName.of("catalog"),
                        ServiceProvider.EMPTY,
                        new DefaultActivator(ServiceProvider.EMPTY),
                        errorHandler,
                        options);
        context =
                new RequestContext(
                        new SchemaBuilder().name("catalog").create(),
                        ServiceProvider.EMPTY,
                        errorHandler,
                        QueryRequest.of("{ a }"),
                        new CancellationToken());
    }

    @Test
    void shouldConvertSynchronousThrow() throws Exception {
        // Given
        RequestDelegate throwing =
                ctx -> {
                    throw new IllegalStateException("secret detail");
                };

        // When
        invoke(throwing);

        // Then
        ExecutionError error = context.getResult().errors().get(0);
        assertThat(error.code()).isEqualTo(ErrorCodes.UNEXPECTED);
        assertThat(error.message()).doesNotContain("secret detail");
    }

    @Test
    void shouldConvertFailedStage() throws Exception {
        // When
        invoke(ctx -> CompletableFuture.failedFuture(new IllegalArgumentException("bad")));

        // Then
        assertThat(context.getResult().errors())
                .singleElement()
                .satisfies(error -> assertThat(error.code()).isEqualTo(ErrorCodes.UNEXPECTED));
    }

    @Test
    void shouldReportCancellation() throws Exception {
        // When
        invoke(ctx -> CompletableFuture.failedFuture(new CancellationException("stopped")));

        // Then
        assertThat(context.getResult().errors())
                .singleElement()
                .satisfies(error -> assertThat(error.code()).isEqualTo(ErrorCodes.CANCELLED));
    }

    @Test
    void shouldLeaveSuccessfulRequestUntouched() throws Exception {
        // When
        invoke(ctx -> CompletableFuture.completedFuture(null));

        // Then
        assertThat(context.getResult()).isNull();
    }

    private void invoke(RequestDelegate next) throws Exception {
        new ExceptionMiddleware()
                .create(factoryContext, next)
                .invoke(context)
                .toCompletableFuture()
                .get(5, TimeUnit.SECONDS);
    }
}
