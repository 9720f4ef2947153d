package io.lattice.core.execution;

import java.util.concurrent.CompletionStage;

/**
 * Executes the operation of a request: parsing, validation and field resolution.
 *
 * <p>Provided by the query engine and registered with the {@link
 * io.lattice.core.service.ServiceProvider}; the default pipeline delegates to it as its last
 * step.
 *
 * @see io.lattice.core.execution.pipeline.OperationExecutionMiddleware
 */
@FunctionalInterface
public interface OperationExecutor {

    /**
     * Executes the request held by {@code context}.
     *
     * @param context the request context, not null
     * @return stage completing with the result, not null
     */
    CompletionStage<QueryResult> execute(RequestContext context);
}
