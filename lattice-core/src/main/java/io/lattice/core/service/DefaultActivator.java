package io.lattice.core.service;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * {@link Activator} that resolves registered services first, then explicitly registered
 * factories.
 *
 * <p>Types are never instantiated reflectively. A helper that is not a service must be
 * registered with {@link #register(Class, Supplier)}.
 *
 * @implNote Thread-safe. Factories may be registered while pipelines are being assembled.
 */
public class DefaultActivator implements Activator {

    private final ServiceProvider services;
    private final Map<Class<?>, Supplier<?>> factories = new ConcurrentHashMap<>();

    public DefaultActivator(ServiceProvider services) {
        this.services = Objects.requireNonNull(services, "services");
    }

    /**
     * Registers a factory for {@code type}, replacing any previous one.
     *
     * @param type the helper type, not null
     * @param factory creates a new instance per call, not null
     * @param <T> the helper type
     * @return this activator
     */
    public <T> DefaultActivator register(Class<T> type, Supplier<? extends T> factory) {
        factories.put(
                Objects.requireNonNull(type, "type"), Objects.requireNonNull(factory, "factory"));
        return this;
    }

    @Override
    public <T> T getOrCreate(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return services.getService(type).orElseGet(() -> create(type));
    }

    private <T> T create(Class<T> type) {
        Supplier<?> factory = factories.get(type);
        if (factory == null) {
            throw new IllegalStateException(
                    "Cannot activate " + type.getName() + ": no service or factory registered");
        }
        Object instance = factory.get();
        if (instance == null) {
            throw new IllegalStateException("Factory for " + type.getName() + " returned null");
        }
        return type.cast(instance);
    }
}
