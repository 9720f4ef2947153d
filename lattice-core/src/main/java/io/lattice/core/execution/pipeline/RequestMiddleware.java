package io.lattice.core.execution.pipeline;

/**
 * Factory for one pipeline step.
 *
 * <p>Called once per executor build. The returned delegate decides when (and whether) to call
 * {@code next}; code before that call runs on the way in, code chained after it runs on the
 * way out.
 *
 * <pre>{@code
 * RequestMiddleware timing = (factoryContext, next) -> context -> {
 *     long start = System.nanoTime();
 *     return next.invoke(context)
 *             .thenRun(() -> record(System.nanoTime() - start));
 * };
 * }</pre>
 *
 * @see PipelineAssembler
 */
@FunctionalInterface
public interface RequestMiddleware {

    /**
     * Creates this step's delegate.
     *
     * @param context build-time context shared by all middleware of the executor, not null
     * @param next the remainder of the pipeline, not null
     * @return the delegate, not null
     */
    RequestDelegate create(MiddlewareFactoryContext context, RequestDelegate next);
}
