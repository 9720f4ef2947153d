package io.lattice.core.exception;

import io.lattice.core.execution.ExecutorName;
import java.io.Serial;

/**
 * Thrown when a supplied or constructed schema carries a name other than the executor name it
 * was requested for.
 *
 * <p>Indicates a configuration bug, not a transient condition. The failing executor is never
 * cached.
 */
public class SchemaNameMismatchException extends RuntimeException {
    @Serial private static final long serialVersionUID = 7458853211036985730L;

    private final ExecutorName expected;
    private final String actual;

    public SchemaNameMismatchException(ExecutorName expected, String actual) {
        super(
                "The schema name must match the executor name. Expected `"
                        + expected.value()
                        + "` but was `"
                        + actual
                        + "`.");
        this.expected = expected;
        this.actual = actual;
    }

    public ExecutorName getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
