package io.lattice.core.options;

import io.lattice.core.execution.ExecutorName;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory {@link FactoryOptionsMonitor}.
 *
 * <p>Every {@link #configure} or {@link #remove} call notifies subscribers with the affected
 * name once the new options are visible to {@link #get}.
 *
 * @implNote Thread-safe. Options are stored in a {@link ConcurrentHashMap} and updated with
 *     {@link ConcurrentHashMap#compute}; subscribers live in a {@link CopyOnWriteArrayList} and
 *     are notified outside the update.
 */
public class InMemoryFactoryOptionsMonitor implements FactoryOptionsMonitor {

    private static final Logger logger =
            Logger.getLogger(InMemoryFactoryOptionsMonitor.class.getName());

    private final Map<ExecutorName, ExecutorFactoryOptions> options = new ConcurrentHashMap<>();
    private final List<Consumer<ExecutorName>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public ExecutorFactoryOptions get(ExecutorName name) {
        return options.getOrDefault(name, ExecutorFactoryOptions.empty());
    }

    /**
     * Updates the options of {@code name} and notifies subscribers.
     *
     * @param name the executor name, not null
     * @param update receives a builder pre-filled with the current options, not null
     * @return the stored options, never null
     */
    public ExecutorFactoryOptions configure(
            ExecutorName name, UnaryOperator<ExecutorFactoryOptions.Builder> update) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(update, "update");
        ExecutorFactoryOptions updated =
                options.compute(
                        name,
                        (key, current) ->
                                update.apply(
                                                current == null
                                                        ? ExecutorFactoryOptions.builder()
                                                        : current.toBuilder())
                                        .build());
        notifyChanged(name);
        return updated;
    }

    /**
     * Replaces the options of {@code name} and notifies subscribers.
     *
     * @param name the executor name, not null
     * @param factoryOptions the new options, not null
     */
    public void put(ExecutorName name, ExecutorFactoryOptions factoryOptions) {
        options.put(
                Objects.requireNonNull(name, "name"),
                Objects.requireNonNull(factoryOptions, "factoryOptions"));
        notifyChanged(name);
    }

    /**
     * Removes all options of {@code name} and notifies subscribers if anything was removed.
     *
     * @param name the executor name, not null
     * @return {@code true} if options were removed
     */
    public boolean remove(ExecutorName name) {
        boolean removed = options.remove(name) != null;
        if (removed) {
            notifyChanged(name);
        }
        return removed;
    }

    @Override
    public Subscription onChange(Consumer<ExecutorName> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void notifyChanged(ExecutorName name) {
        for (Consumer<ExecutorName> listener : listeners) {
            try {
                listener.accept(name);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Options change listener failed for " + name, e);
            }
        }
    }
}
