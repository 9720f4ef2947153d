package io.lattice.serialization;

import io.lattice.core.options.ExecutorSettings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of an executor settings document.
 *
 * <pre>{@code
 * {
 *   "executors": {
 *     "catalog": { "executionTimeout": "PT10S", "includeExceptionDetails": true }
 *   }
 * }
 * }</pre>
 *
 * @param executors settings by executor name, never null; iteration follows document order
 */
public record ExecutorSettingsDocument(Map<String, ExecutorSettings> executors) {

    public ExecutorSettingsDocument {
        executors =
                executors == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(executors));
    }
}
