package io.lattice.core.execution;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.diagnostics.DiagnosticEvents;
import io.lattice.core.error.ErrorCodes;
import io.lattice.core.error.ErrorHandler;
import io.lattice.core.error.ExecutionError;
import io.lattice.core.execution.pipeline.RequestDelegate;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.schema.Schema;
import io.lattice.core.service.Activator;
import io.lattice.core.service.ServiceProvider;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Standard {@link RequestExecutor} assembled by {@link DefaultRequestExecutorResolver}.
 *
 * @implNote All fields are final and set at construction time.
 */
public final class DefaultRequestExecutor implements RequestExecutor {

    private final Schema schema;
    private final ServiceProvider services;
    private final ErrorHandler errorHandler;
    private final Activator activator;
    private final DiagnosticEvents diagnosticEvents;
    private final ExecutorOptions options;
    private final RequestDelegate pipeline;

    public DefaultRequestExecutor(
            Schema schema,
            ServiceProvider services,
            ErrorHandler errorHandler,
            Activator activator,
            DiagnosticEvents diagnosticEvents,
            ExecutorOptions options,
            RequestDelegate pipeline) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.services = Objects.requireNonNull(services, "services");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
        this.activator = Objects.requireNonNull(activator, "activator");
        this.diagnosticEvents = Objects.requireNonNull(diagnosticEvents, "diagnosticEvents");
        this.options = Objects.requireNonNull(options, "options");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    @Override
    public Schema getSchema() {
        return schema;
    }

    @Override
    public ServiceProvider getServices() {
        return services;
    }

    @Override
    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public Activator getActivator() {
        return activator;
    }

    @Override
    public DiagnosticEvents getDiagnosticEvents() {
        return diagnosticEvents;
    }

    @Override
    public ExecutorOptions getOptions() {
        return options;
    }

    @Override
    public RequestDelegate getPipeline() {
        return pipeline;
    }

    @Override
    public CompletionStage<QueryResult> execute(QueryRequest request, CancellationToken token) {
        RequestContext context = new RequestContext(schema, services, errorHandler, request, token);

        CompletionStage<Void> running;
        try {
            running = pipeline.invoke(context);
        } catch (RuntimeException e) {
            running = CompletableFuture.failedFuture(e);
        }

        return running.handle(
                (ignored, failure) -> {
                    if (failure != null) {
                        Throwable cause =
                                failure instanceof CompletionException && failure.getCause() != null
                                        ? failure.getCause()
                                        : failure;
                        return QueryResult.ofError(errorHandler.createUnexpectedError(cause));
                    }
                    QueryResult result = context.getResult();
                    if (result == null) {
                        return QueryResult.ofError(
                                errorHandler.handle(
                                        ExecutionError.of(
                                                "The request pipeline did not produce a result",
                                                ErrorCodes.NO_RESULT)));
                    }
                    return result;
                });
    }
}
