package io.lattice.core.execution.pipeline;

import io.lattice.core.error.ErrorCodes;
import io.lattice.core.error.ErrorHandler;
import io.lattice.core.error.ExecutionError;
import io.lattice.core.execution.QueryResult;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts failures of the remaining pipeline into an error result.
 *
 * <p>Both synchronous throws and exceptionally completed stages are caught. The error is
 * created through the executor's {@link ErrorHandler}, so filters and the exception-detail
 * setting apply. A {@link CancellationException} is reported with {@link
 * ErrorCodes#CANCELLED}; every other failure as an unexpected error.
 */
public final class ExceptionMiddleware implements RequestMiddleware {

    private static final Logger logger = Logger.getLogger(ExceptionMiddleware.class.getName());

    @Override
    public RequestDelegate create(MiddlewareFactoryContext factoryContext, RequestDelegate next) {
        ErrorHandler errorHandler = factoryContext.errorHandler();

        return context -> {
            CompletionStage<Void> running;
            try {
                running = next.invoke(context);
            } catch (RuntimeException e) {
                running = CompletableFuture.failedFuture(e);
            }

            return running.handle(
                    (ignored, failure) -> {
                        if (failure != null) {
                            Throwable cause =
                                    failure instanceof CompletionException
                                                    && failure.getCause() != null
                                            ? failure.getCause()
                                            : failure;
                            logger.log(
                                    Level.FINE,
                                    "Request failed on executor "
                                            + factoryContext.executorName(),
                                    cause);
                            ExecutionError error =
                                    cause instanceof CancellationException
                                            ? errorHandler.handle(
                                                    ExecutionError.of(
                                                                    "The request was cancelled.",
                                                                    ErrorCodes.CANCELLED)
                                                            .withException(cause))
                                            : errorHandler.createUnexpectedError(cause);
                            context.setResult(QueryResult.ofError(error));
                        }
                        return null;
                    });
        };
    }
}
