package io.lattice.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A query request handed to a {@link RequestExecutor}.
 *
 * @param query the query document text, not null
 * @param operationName the operation to run, may be null
 * @param variables variable values, never null (may be empty)
 */
public record QueryRequest(String query, String operationName, Map<String, Object> variables) {

    public QueryRequest {
        Objects.requireNonNull(query, "query");
        variables =
                variables == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static QueryRequest of(String query) {
        return new QueryRequest(query, null, Map.of());
    }
}
