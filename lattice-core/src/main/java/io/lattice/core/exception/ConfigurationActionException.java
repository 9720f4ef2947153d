package io.lattice.core.exception;

import java.io.Serial;

/**
 * Wraps a checked failure raised by an asynchronous configure action.
 *
 * <p>Unchecked failures thrown by configure actions are propagated unchanged and never wrapped
 * in this type.
 */
public class ConfigurationActionException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2671450930127735581L;

    public ConfigurationActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
