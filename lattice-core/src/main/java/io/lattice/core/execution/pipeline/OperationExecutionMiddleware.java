package io.lattice.core.execution.pipeline;

import io.lattice.core.error.ErrorCodes;
import io.lattice.core.error.ExecutionError;
import io.lattice.core.execution.OperationExecutor;
import io.lattice.core.execution.QueryResult;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the request's operation through the {@link OperationExecutor} registered with the
 * service provider, then continues with the rest of the pipeline.
 *
 * <p>Without a registered executor the request fails with {@link
 * ErrorCodes#NO_OPERATION_EXECUTOR}.
 */
public final class OperationExecutionMiddleware implements RequestMiddleware {

    @Override
    public RequestDelegate create(MiddlewareFactoryContext factoryContext, RequestDelegate next) {
        OperationExecutor operationExecutor =
                factoryContext.services().getService(OperationExecutor.class).orElse(null);

        return context -> {
            if (operationExecutor == null) {
                context.setResult(
                        QueryResult.ofError(
                                factoryContext
                                        .errorHandler()
                                        .handle(
                                                ExecutionError.of(
                                                        "No operation executor is registered for executor `"
                                                                + factoryContext.executorName()
                                                                + "`.",
                                                        ErrorCodes.NO_OPERATION_EXECUTOR))));
                return CompletableFuture.completedFuture(null);
            }
            context.getCancellationToken().throwIfCancellationRequested();
            return operationExecutor
                    .execute(context)
                    .thenCompose(
                            result -> {
                                context.setResult(result);
                                return next.invoke(context);
                            });
        };
    }
}
