package io.lattice.core.exception;

import java.io.Serial;
import java.util.concurrent.CancellationException;

/**
 * Thrown when an executor build observes a cancellation request at a suspension point.
 *
 * <p>Distinct from a build failure: the name's configuration is not known to be broken, and
 * the caller may simply retry.
 */
public class BuildCancelledException extends CancellationException {
    @Serial private static final long serialVersionUID = 3180241377025941466L;

    public BuildCancelledException(String message) {
        super(message);
    }

    public BuildCancelledException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }
}
