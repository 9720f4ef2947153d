package io.lattice.core.execution;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.exception.BuildCancelledException;
import io.lattice.core.exception.ResolverDisposedException;
import io.lattice.core.exception.SchemaNameMismatchException;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves, caches and evicts {@link RequestExecutor}s by {@link ExecutorName}.
 *
 * <h3>Contracts</h3>
 *
 * <ul>
 *   <li><b>Postcondition</b>: repeated lookups return the identical instance until the name is
 *       evicted
 *   <li><b>Invariant</b>: at most one executor is cached per name; a failed or cancelled build
 *       caches nothing
 *   <li><b>Invariant</b>: a cached executor's schema name equals its executor name
 * </ul>
 *
 * @implNote Implementations must be thread-safe. Lookups are expected to be called
 *     concurrently from many request threads.
 * @see DefaultRequestExecutorResolver
 */
public interface RequestExecutorResolver extends AutoCloseable {

    /**
     * Returns the executor for {@code name}, building and caching it if necessary.
     *
     * @param name the executor name; null means {@link ExecutorName#DEFAULT}
     * @param token cancellation signal honored while building, not null
     * @return the executor, never null
     * @throws BuildCancelledException if the build was cancelled
     * @throws SchemaNameMismatchException if the configured schema has another name
     * @throws ResolverDisposedException if the resolver was closed
     */
    RequestExecutor getRequestExecutor(ExecutorName name, CancellationToken token);

    default RequestExecutor getRequestExecutor(ExecutorName name) {
        return getRequestExecutor(name, CancellationToken.NONE);
    }

    default RequestExecutor getRequestExecutor() {
        return getRequestExecutor(ExecutorName.DEFAULT, CancellationToken.NONE);
    }

    /**
     * Asynchronous variant of {@link #getRequestExecutor(ExecutorName, CancellationToken)}.
     *
     * <p>Completes immediately when the executor is cached.
     *
     * @param name the executor name; null means {@link ExecutorName#DEFAULT}
     * @param token cancellation signal honored while building, not null
     * @return future completing with the executor or the build failure, never null
     */
    CompletableFuture<RequestExecutor> getRequestExecutorAsync(
            ExecutorName name, CancellationToken token);

    default CompletableFuture<RequestExecutor> getRequestExecutorAsync(ExecutorName name) {
        return getRequestExecutorAsync(name, CancellationToken.NONE);
    }

    /**
     * Removes the cached executor for {@code name}.
     *
     * @apiNote <b>Side effects</b>: when an entry existed, notifies diagnostics and listeners
     *     with the removed executor.
     * @param name the executor name; null means {@link ExecutorName#DEFAULT}
     * @return {@code true} if an executor was removed
     * @throws ResolverDisposedException if the resolver was closed
     */
    boolean evictRequestExecutor(ExecutorName name);

    default boolean evictRequestExecutor() {
        return evictRequestExecutor(ExecutorName.DEFAULT);
    }

    void addListener(RequestExecutorListener listener);

    void removeListener(RequestExecutorListener listener);

    /**
     * Clears the cache and releases resources. Idempotent.
     *
     * <p>Waits for an in-flight build to finish; that build then fails with {@link
     * ResolverDisposedException} instead of being cached.
     */
    @Override
    void close();
}
