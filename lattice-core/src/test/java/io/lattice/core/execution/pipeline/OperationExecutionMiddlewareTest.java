package io.lattice.core.execution.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.error.DefaultErrorHandler;
import io.lattice.core.error.ErrorCodes;
import io.lattice.core.error.ErrorHandler;
import io.lattice.core.execution.ExecutorName;
import io.lattice.core.execution.OperationExecutor;
import io.lattice.core.execution.QueryRequest;
import io.lattice.core.execution.QueryResult;
import io.lattice.core.execution.RequestContext;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.schema.SchemaBuilder;
import io.lattice.core.service.DefaultActivator;
import io.lattice.core.service.DefaultServiceProvider;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OperationExecutionMiddlewareTest {

    @Mock private OperationExecutor operationExecutor;

    private DefaultServiceProvider services;
    private ErrorHandler errorHandler;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        services = new DefaultServiceProvider();
        errorHandler = new DefaultErrorHandler(List.of(), new ExecutorOptions());
        context =
                new RequestContext(
                        new SchemaBuilder().name("catalog").create(),
                        services,
                        errorHandler,
                        QueryRequest.of("{ products }"),
                        new CancellationToken());
    }

    @Test
    void shouldSetResultBeforeContinuing() throws Exception {
        // Given
        QueryResult result = QueryResult.ofData(Map.of("products", List.of()));
        when(operationExecutor.execute(any())).thenReturn(CompletableFuture.completedFuture(result));
        services.register(OperationExecutor.class, operationExecutor);
        AtomicReference<QueryResult> seenByNext = new AtomicReference<>();
        RequestDelegate next =
                ctx -> {
                    seenByNext.set(ctx.getResult());
                    return CompletableFuture.completedFuture(null);
                };

        // When
        create(next).invoke(context).toCompletableFuture().get(5, TimeUnit.SECONDS);

        // Then
        assertThat(context.getResult()).isSameAs(result);
        assertThat(seenByNext.get()).isSameAs(result);
        verify(operationExecutor).execute(context);
    }

    @Test
    void shouldReportMissingOperationExecutor() throws Exception {
        // When
        create(ctx -> CompletableFuture.completedFuture(null))
                .invoke(context)
                .toCompletableFuture()
                .get(5, TimeUnit.SECONDS);

        // Then
        assertThat(context.getResult().errors())
                .singleElement()
                .satisfies(
                        error -> {
                            assertThat(error.code()).isEqualTo(ErrorCodes.NO_OPERATION_EXECUTOR);
                            assertThat(error.message()).contains("catalog");
                        });
    }

    private RequestDelegate create(RequestDelegate next) {
        MiddlewareFactoryContext factoryContext =
                new MiddlewareFactoryContext(
                        ExecutorName.of("catalog"),
                        services,
                        new DefaultActivator(services),
                        errorHandler,
                        new ExecutorOptions());
        return new OperationExecutionMiddleware().create(factoryContext, next);
    }
}
