package io.lattice.core.error;

import io.lattice.core.options.ExecutorOptions;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

/**
 * {@link ErrorHandler} applying an ordered list of {@link ErrorFilter}s.
 *
 * <p>Unexpected errors carry the message {@code "Unexpected Execution Error"}. The original
 * exception message and stack trace are added as extensions only when {@link
 * ExecutorOptions#isIncludeExceptionDetails()} is set; otherwise the exception is stripped
 * after filtering so it cannot leak into a response.
 *
 * @implNote Thread-safe. The filter list is copied at construction time.
 */
public class DefaultErrorHandler implements ErrorHandler {

    static final String UNEXPECTED_MESSAGE = "Unexpected Execution Error";

    private final List<ErrorFilter> filters;
    private final boolean includeExceptionDetails;

    public DefaultErrorHandler(List<ErrorFilter> filters, ExecutorOptions options) {
        this.filters = List.copyOf(filters);
        this.includeExceptionDetails = options.isIncludeExceptionDetails();
    }

    @Override
    public ExecutionError handle(ExecutionError error) {
        ExecutionError current = error;
        for (ErrorFilter filter : filters) {
            current = filter.onError(current);
            if (current == null) {
                throw new IllegalStateException(
                        "Error filter " + filter.getClass().getName() + " returned null");
            }
        }
        return includeExceptionDetails ? current : current.withoutException();
    }

    @Override
    public ExecutionError createUnexpectedError(Throwable exception) {
        ExecutionError error =
                ExecutionError.of(UNEXPECTED_MESSAGE, ErrorCodes.UNEXPECTED)
                        .withException(exception);
        if (includeExceptionDetails) {
            error =
                    error.withExtension("message", String.valueOf(exception.getMessage()))
                            .withExtension("stackTrace", stackTrace(exception));
        }
        return handle(error);
    }

    /**
     * Returns the filters in the order they are applied.
     *
     * @return unmodifiable list, never null
     */
    public List<ErrorFilter> getFilters() {
        return filters;
    }

    private static String stackTrace(Throwable exception) {
        StringWriter writer = new StringWriter();
        exception.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
