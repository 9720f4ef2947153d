package io.lattice.core.exception;

import java.io.Serial;

/** Thrown by any resolver operation invoked after the resolver was closed. */
public class ResolverDisposedException extends IllegalStateException {
    @Serial private static final long serialVersionUID = -4209863381750113408L;

    public ResolverDisposedException(String message) {
        super(message);
    }
}
