package io.lattice.core.error;

/**
 * Turns failures raised while handling a request into reportable {@link ExecutionError}s.
 *
 * @see DefaultErrorHandler
 */
public interface ErrorHandler {

    /**
     * Runs {@code error} through the configured filters.
     *
     * @param error the raw error, not null
     * @return the filtered error, never null
     */
    ExecutionError handle(ExecutionError error);

    /**
     * Creates and filters an error for an exception nobody handled.
     *
     * @param exception the unhandled exception, not null
     * @return the filtered error, never null
     */
    ExecutionError createUnexpectedError(Throwable exception);
}
