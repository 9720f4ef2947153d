package io.lattice.core.execution;

/**
 * Listener for executor lifecycle events published by a {@link RequestExecutorResolver}.
 *
 * <p>All methods have default no-op implementations, allowing listeners to override only the
 * events they care about.
 *
 * <h3>Callback Lifecycle</h3>
 *
 * <pre>
 * onExecutorCreated(name, executor)   build succeeded, executor is cached
 * onExecutorEvicted(name, executor)   executor removed; next lookup rebuilds it
 * </pre>
 *
 * @implNote Callbacks run synchronously on the thread that built or evicted the executor, after
 *     the build lock has been released. They may arrive from several threads at once. A
 *     listener that throws is logged and skipped.
 */
public interface RequestExecutorListener {

    /**
     * Called after a newly built executor has been cached.
     *
     * @param name the executor name, not null
     * @param executor the new executor, not null
     */
    default void onExecutorCreated(ExecutorName name, RequestExecutor executor) {}

    /**
     * Called after an executor has been evicted.
     *
     * <p>Requests already running on {@code executor} continue to completion.
     *
     * @param name the executor name, not null
     * @param executor the evicted executor, not null
     */
    default void onExecutorEvicted(ExecutorName name, RequestExecutor executor) {}

    /** No-op listener instance that ignores all events. */
    RequestExecutorListener NOOP = new RequestExecutorListener() {};
}
