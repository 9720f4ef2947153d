package io.lattice.core.execution.pipeline;

import io.lattice.core.error.ErrorHandler;
import io.lattice.core.execution.ExecutorName;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.service.Activator;
import io.lattice.core.service.ServiceProvider;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Composes an ordered list of {@link RequestMiddleware} into one {@link RequestDelegate}.
 *
 * <p>The list is folded right to left over a terminal delegate that does nothing, so the
 * composed pipeline calls the middleware in list order and each one wraps everything after
 * it:
 *
 * <pre>
 * [M1, M2, M3]  →  M1-pre, M2-pre, M3-pre, terminal, M3-post, M2-post, M1-post
 * </pre>
 *
 * <h3>Contracts</h3>
 *
 * <ul>
 *   <li><b>Postcondition</b>: the pipeline is never empty; an empty list is replaced with
 *       {@link DefaultPipeline#middleware()}
 *   <li><b>Invariant</b>: every factory receives the same {@link MiddlewareFactoryContext}
 *   <li><b>Invariant</b>: each factory is called exactly once
 * </ul>
 */
public final class PipelineAssembler {

    private static final RequestDelegate TERMINAL =
            context -> CompletableFuture.completedFuture(null);

    private PipelineAssembler() {}

    /**
     * Builds the pipeline of one executor.
     *
     * @param executorName the executor being built, not null
     * @param middleware ordered middleware, not null (may be empty)
     * @param services the service provider, not null
     * @param activator helper factory, not null
     * @param errorHandler the executor's error handler, not null
     * @param options the resolved executor options, not null
     * @return the composed pipeline, never null
     */
    public static RequestDelegate compose(
            ExecutorName executorName,
            List<RequestMiddleware> middleware,
            ServiceProvider services,
            Activator activator,
            ErrorHandler errorHandler,
            ExecutorOptions options) {
        List<RequestMiddleware> steps =
                middleware.isEmpty() ? DefaultPipeline.middleware() : middleware;

        MiddlewareFactoryContext factoryContext =
                new MiddlewareFactoryContext(
                        executorName, services, activator, errorHandler, options);

        RequestDelegate next = TERMINAL;
        for (int i = steps.size() - 1; i >= 0; i--) {
            next = steps.get(i).create(factoryContext, next);
        }
        return next;
    }
}
