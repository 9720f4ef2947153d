package io.lattice.core.execution;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.error.ErrorHandler;
import io.lattice.core.schema.Schema;
import io.lattice.core.service.ServiceProvider;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-request state flowing through the middleware pipeline.
 *
 * <p>Created by {@link RequestExecutor#execute} for each request. Middleware reads the request,
 * may replace the cancellation token with a linked one, and sets the result.
 *
 * @implNote The result and token fields are volatile because asynchronous middleware may
 *     continue on another thread. Context data is a {@link ConcurrentHashMap}.
 */
public final class RequestContext {

    private final Schema schema;
    private final ServiceProvider services;
    private final ErrorHandler errorHandler;
    private final QueryRequest request;
    private final Map<String, Object> contextData = new ConcurrentHashMap<>();
    private volatile CancellationToken cancellationToken;
    private volatile QueryResult result;

    public RequestContext(
            Schema schema,
            ServiceProvider services,
            ErrorHandler errorHandler,
            QueryRequest request,
            CancellationToken cancellationToken) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.services = Objects.requireNonNull(services, "services");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
        this.request = Objects.requireNonNull(request, "request");
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken");
    }

    public Schema getSchema() {
        return schema;
    }

    public ServiceProvider getServices() {
        return services;
    }

    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public QueryRequest getRequest() {
        return request;
    }

    public Map<String, Object> getContextData() {
        return contextData;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public void setCancellationToken(CancellationToken cancellationToken) {
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken");
    }

    /**
     * Returns the result set by middleware so far.
     *
     * @return the result, or null if none was set yet
     */
    public QueryResult getResult() {
        return result;
    }

    public void setResult(QueryResult result) {
        this.result = result;
    }
}
