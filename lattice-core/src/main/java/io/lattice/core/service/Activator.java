package io.lattice.core.service;

/**
 * Creates helper instances requested by middleware at pipeline construction time.
 *
 * @see DefaultActivator
 */
@FunctionalInterface
public interface Activator {

    /**
     * Returns an instance of {@code type}.
     *
     * @param type the requested type, not null
     * @param <T> the requested type
     * @return an instance, never null
     * @throws IllegalStateException if no instance can be provided
     */
    <T> T getOrCreate(Class<T> type);
}
