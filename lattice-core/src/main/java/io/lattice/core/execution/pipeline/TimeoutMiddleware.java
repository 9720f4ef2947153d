package io.lattice.core.execution.pipeline;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.error.ErrorCodes;
import io.lattice.core.error.ExecutionError;
import io.lattice.core.execution.QueryResult;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds the remaining pipeline by {@link
 * io.lattice.core.options.ExecutorOptions#getExecutionTimeout()}.
 *
 * <p>Replaces the request token with a linked token. When the timeout elapses, that token is
 * cancelled so downstream work can stop, and a timeout error becomes the request result. The
 * linked token is detached from the caller's token when the request completes.
 */
public final class TimeoutMiddleware implements RequestMiddleware {

    @Override
    public RequestDelegate create(MiddlewareFactoryContext factoryContext, RequestDelegate next) {
        Duration timeout = factoryContext.options().getExecutionTimeout();

        return context -> {
            CancellationToken requestToken = context.getCancellationToken().link();
            context.setCancellationToken(requestToken);

            CompletionStage<Void> running;
            try {
                running = next.invoke(context);
            } catch (RuntimeException e) {
                requestToken.unlink();
                throw e;
            }

            return running.toCompletableFuture()
                    .copy()
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .<Void>handle(
                            (ignored, failure) -> {
                                if (failure == null) {
                                    return null;
                                }
                                Throwable cause =
                                        failure instanceof CompletionException
                                                        && failure.getCause() != null
                                                ? failure.getCause()
                                                : failure;
                                if (cause instanceof TimeoutException) {
                                    requestToken.cancel();
                                    context.setResult(
                                            QueryResult.ofError(
                                                    factoryContext
                                                            .errorHandler()
                                                            .<Void>handle(
                                                                    ExecutionError.of(
                                                                            "The request exceeded the configured timeout of `"
                                                                                    + timeout
                                                                                    + "`.",
                                                                            ErrorCodes.TIMEOUT))));
                                    return null;
                                }
                                throw failure instanceof CompletionException completion
                                        ? completion
                                        : new CompletionException(cause);
                            })
                    .whenComplete((ignored, failure) -> requestToken.unlink());
        };
    }
}
