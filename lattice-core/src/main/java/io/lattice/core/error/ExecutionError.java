package io.lattice.core.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Error reported in a request result.
 *
 * <p>Immutable. {@link ErrorFilter}s derive modified copies through the {@code with*} methods.
 *
 * @param message human readable message, not null
 * @param code machine readable code, may be null
 * @param path location in the result the error refers to, never null (may be empty)
 * @param exception the underlying exception, may be null
 * @param extensions additional error data, never null
 */
public record ExecutionError(
        String message,
        String code,
        List<Object> path,
        Throwable exception,
        Map<String, Object> extensions) {

    public ExecutionError {
        Objects.requireNonNull(message, "message");
        path = path == null ? List.of() : List.copyOf(path);
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    /**
     * Creates an error with only a message and a code.
     *
     * @param message the message, not null
     * @param code the code, may be null
     * @return the error, never null
     */
    public static ExecutionError of(String message, String code) {
        return new ExecutionError(message, code, List.of(), null, Map.of());
    }

    public ExecutionError withMessage(String message) {
        return new ExecutionError(message, code, path, exception, extensions);
    }

    public ExecutionError withCode(String code) {
        return new ExecutionError(message, code, path, exception, extensions);
    }

    public ExecutionError withException(Throwable exception) {
        return new ExecutionError(message, code, path, exception, extensions);
    }

    public ExecutionError withoutException() {
        return new ExecutionError(message, code, path, null, extensions);
    }

    public ExecutionError withExtension(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(extensions);
        updated.put(key, value);
        return new ExecutionError(message, code, path, exception, updated);
    }
}
