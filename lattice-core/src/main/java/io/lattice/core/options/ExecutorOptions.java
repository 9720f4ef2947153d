package io.lattice.core.options;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime options of a request executor.
 *
 * <p>Configure actions mutate an instance during the build; once the build hands it to the
 * executor it is treated as read-only.
 *
 * <h3>Default Values</h3>
 *
 * <ul>
 *   <li>{@code executionTimeout}: 30 seconds (minimum 100 ms)
 *   <li>{@code includeExceptionDetails}: {@code false}
 *   <li>{@code queryCacheSize}: 100 (minimum 10)
 * </ul>
 *
 * @implNote <b>Not thread-safe</b>. Each build works on its own instance, created fresh or
 *     copied from the configured base via {@link #copy()}.
 * @see ExecutorOptionsAssembler
 */
public class ExecutorOptions {

    public static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration MIN_EXECUTION_TIMEOUT = Duration.ofMillis(100);
    public static final int DEFAULT_QUERY_CACHE_SIZE = 100;
    public static final int MIN_QUERY_CACHE_SIZE = 10;

    private Duration executionTimeout = DEFAULT_EXECUTION_TIMEOUT;
    private boolean includeExceptionDetails;
    private int queryCacheSize = DEFAULT_QUERY_CACHE_SIZE;
    private final Map<String, Object> contextData = new HashMap<>();

    /** Creates options with default values. */
    public ExecutorOptions() {}

    /**
     * Returns the maximum time a single request may run.
     *
     * @return execution timeout, never null
     */
    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    /**
     * Sets the execution timeout. Values below {@link #MIN_EXECUTION_TIMEOUT} are raised to it.
     *
     * @param executionTimeout the timeout, not null
     * @return this options object
     */
    public ExecutorOptions setExecutionTimeout(Duration executionTimeout) {
        Objects.requireNonNull(executionTimeout, "executionTimeout");
        this.executionTimeout =
                executionTimeout.compareTo(MIN_EXECUTION_TIMEOUT) < 0
                        ? MIN_EXECUTION_TIMEOUT
                        : executionTimeout;
        return this;
    }

    /**
     * Returns whether unexpected errors keep their exception message and stack trace.
     *
     * @return {@code true} if exception details are exposed
     */
    public boolean isIncludeExceptionDetails() {
        return includeExceptionDetails;
    }

    public ExecutorOptions setIncludeExceptionDetails(boolean includeExceptionDetails) {
        this.includeExceptionDetails = includeExceptionDetails;
        return this;
    }

    /**
     * Returns the number of parsed documents an executor may keep cached.
     *
     * @return cache size, at least {@link #MIN_QUERY_CACHE_SIZE}
     */
    public int getQueryCacheSize() {
        return queryCacheSize;
    }

    /**
     * Sets the query cache size. Values below {@link #MIN_QUERY_CACHE_SIZE} are raised to it.
     *
     * @param queryCacheSize number of cached documents
     * @return this options object
     */
    public ExecutorOptions setQueryCacheSize(int queryCacheSize) {
        this.queryCacheSize = Math.max(MIN_QUERY_CACHE_SIZE, queryCacheSize);
        return this;
    }

    /**
     * Returns free-form data visible to middleware through the factory context.
     *
     * @return unmodifiable view, never null
     */
    public Map<String, Object> getContextData() {
        return Collections.unmodifiableMap(contextData);
    }

    public ExecutorOptions putContextData(String key, Object value) {
        contextData.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    /**
     * Returns a detached copy of these options.
     *
     * @return new options object with the same values, never null
     */
    public ExecutorOptions copy() {
        ExecutorOptions copy = new ExecutorOptions();
        copy.executionTimeout = executionTimeout;
        copy.includeExceptionDetails = includeExceptionDetails;
        copy.queryCacheSize = queryCacheSize;
        copy.contextData.putAll(contextData);
        return copy;
    }
}
