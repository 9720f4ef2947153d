package io.lattice.core.execution;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.diagnostics.DiagnosticEvents;
import io.lattice.core.error.ErrorHandler;
import io.lattice.core.execution.pipeline.RequestDelegate;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.schema.Schema;
import io.lattice.core.service.ServiceProvider;
import java.util.concurrent.CompletionStage;

/**
 * Ready-to-serve bundle of a schema, its request pipeline and its error handler.
 *
 * <h3>Contracts</h3>
 *
 * <ul>
 *   <li><b>Invariant</b>: immutable after construction; shared by all concurrent callers
 *   <li><b>Invariant</b>: the schema name equals the name the executor was resolved for
 * </ul>
 *
 * @implNote Thread-safe. An executor evicted from the resolver stays usable by callers that
 *     still hold a reference.
 * @see RequestExecutorResolver
 */
public interface RequestExecutor {

    Schema getSchema();

    ServiceProvider getServices();

    ErrorHandler getErrorHandler();

    /**
     * Returns the executor options resolved when this executor was built.
     *
     * @return options, never null; must not be mutated
     */
    ExecutorOptions getOptions();

    DiagnosticEvents getDiagnosticEvents();

    /**
     * Returns the composed request pipeline.
     *
     * @return pipeline, never null
     */
    RequestDelegate getPipeline();

    /**
     * Runs {@code request} through the pipeline.
     *
     * <p>Never completes exceptionally: failures are converted into an error result.
     *
     * @param request the request, not null
     * @param token request cancellation signal, not null
     * @return stage completing with the result, never null
     */
    CompletionStage<QueryResult> execute(QueryRequest request, CancellationToken token);

    default CompletionStage<QueryResult> execute(QueryRequest request) {
        return execute(request, CancellationToken.NONE);
    }
}
