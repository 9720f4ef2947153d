package io.lattice.core.execution;

import io.lattice.core.error.ExecutionError;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a request.
 *
 * @param data result data, may be null when the request failed before execution
 * @param errors reported errors, never null (may be empty)
 */
public record QueryResult(Map<String, Object> data, List<ExecutionError> errors) {

    public QueryResult {
        data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static QueryResult ofData(Map<String, Object> data) {
        return new QueryResult(data, List.of());
    }

    public static QueryResult ofError(ExecutionError error) {
        return new QueryResult(null, List.of(error));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
