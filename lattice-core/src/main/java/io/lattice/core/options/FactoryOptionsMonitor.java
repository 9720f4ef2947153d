package io.lattice.core.options;

import io.lattice.core.execution.ExecutorName;
import java.util.function.Consumer;

/**
 * Source of per-name {@link ExecutorFactoryOptions} with change notifications.
 *
 * <p>The resolver reads options when it builds an executor and subscribes to {@link
 * #onChange} to evict executors whose configuration changed.
 *
 * @implNote Implementations must be thread-safe.
 * @see InMemoryFactoryOptionsMonitor
 */
public interface FactoryOptionsMonitor {

    /**
     * Returns the current options for {@code name}.
     *
     * @param name the executor name, not null
     * @return options, never null; empty options when nothing is configured
     */
    ExecutorFactoryOptions get(ExecutorName name);

    /**
     * Subscribes to configuration changes.
     *
     * @param listener called with the name whose options changed, not null
     * @return handle that unsubscribes when closed, never null
     */
    Subscription onChange(Consumer<ExecutorName> listener);

    /** Handle of an {@link #onChange} subscription. */
    @FunctionalInterface
    interface Subscription extends AutoCloseable {

        /** Stops delivering notifications. Idempotent. */
        @Override
        void close();
    }
}
