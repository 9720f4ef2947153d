package io.lattice.core.diagnostics;

import io.lattice.core.execution.ExecutorName;
import io.lattice.core.execution.RequestExecutor;

/**
 * Sink for executor lifecycle diagnostics (logging, metrics).
 *
 * <p>Notifications are synchronous and fire-and-forget. Implementations must return promptly;
 * an exception thrown by a sink is logged by the caller and never aborts a build or an
 * eviction.
 *
 * @see LoggingDiagnosticEvents
 * @see AggregateDiagnosticEvents
 */
public interface DiagnosticEvents {

    /**
     * Called after a newly built executor has been cached.
     *
     * @param name the executor name, not null
     * @param executor the new executor, not null
     */
    default void executorCreated(ExecutorName name, RequestExecutor executor) {}

    /**
     * Called after an executor has been removed from the cache.
     *
     * @param name the executor name, not null
     * @param executor the removed executor, not null
     */
    default void executorEvicted(ExecutorName name, RequestExecutor executor) {}

    /** Sink that ignores all events. */
    DiagnosticEvents NOOP = new DiagnosticEvents() {};
}
