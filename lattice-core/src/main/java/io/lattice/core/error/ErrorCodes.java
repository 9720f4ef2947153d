package io.lattice.core.error;

/** Error codes produced by the built-in error handler and default middleware. */
public final class ErrorCodes {

    private ErrorCodes() {}

    public static final String UNEXPECTED = "EXEC_UNEXPECTED_ERROR";
    public static final String TIMEOUT = "EXEC_TIMEOUT";
    public static final String CANCELLED = "EXEC_CANCELLED";
    public static final String NO_OPERATION_EXECUTOR = "EXEC_NO_OPERATION_EXECUTOR";
    public static final String NO_RESULT = "EXEC_NO_RESULT";
}
