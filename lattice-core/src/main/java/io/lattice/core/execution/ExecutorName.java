package io.lattice.core.execution;

import java.util.Objects;

/**
 * Identifier of a request executor, used as the resolver's cache key.
 *
 * <p>Names compare by exact value. {@link #DEFAULT} is used whenever a caller does not name an
 * executor.
 *
 * @param value the identifier, not null or blank
 */
public record ExecutorName(String value) {

    /** Name used for unnamed executors. */
    public static final ExecutorName DEFAULT = new ExecutorName("_Default");

    public ExecutorName {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Executor name cannot be blank");
        }
    }

    /**
     * Returns the executor name for {@code value}, falling back to {@link #DEFAULT}.
     *
     * @param value raw name, may be null or blank
     * @return the name, never null
     */
    public static ExecutorName of(String value) {
        return value == null || value.isBlank() ? DEFAULT : new ExecutorName(value);
    }

    /**
     * Returns {@code name}, or {@link #DEFAULT} when it is null.
     *
     * @param name the name, may be null
     * @return the name, never null
     */
    public static ExecutorName orDefault(ExecutorName name) {
        return name == null ? DEFAULT : name;
    }

    @Override
    public String toString() {
        return value;
    }
}
