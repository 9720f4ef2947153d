package io.lattice.core.error;

/**
 * Transforms errors before they are reported.
 *
 * <p>Filters are applied in order by {@link DefaultErrorHandler}; each one receives the output
 * of the previous filter.
 */
@FunctionalInterface
public interface ErrorFilter {

    /**
     * Inspects or rewrites {@code error}.
     *
     * @param error the error so far, not null
     * @return the error to pass on, not null
     */
    ExecutionError onError(ExecutionError error);
}
