package io.lattice.core.service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registration-ordered, in-memory {@link ServiceProvider}.
 *
 * @implNote Thread-safe. Registrations use a {@link ConcurrentHashMap} of {@link
 *     CopyOnWriteArrayList}s, so lookups never block and always see a consistent list.
 */
public class DefaultServiceProvider implements ServiceProvider {

    private final Map<Class<?>, List<Object>> services = new ConcurrentHashMap<>();

    /**
     * Registers {@code instance} under {@code type}.
     *
     * @param type the service type, not null
     * @param instance the service, not null
     * @param <T> the service type
     * @return this provider for chaining
     */
    public <T> DefaultServiceProvider register(Class<T> type, T instance) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(instance, "instance");
        services.computeIfAbsent(type, key -> new CopyOnWriteArrayList<>()).add(instance);
        return this;
    }

    @Override
    public <T> Optional<T> getService(Class<T> type) {
        List<T> registered = getServices(type);
        return registered.isEmpty()
                ? Optional.empty()
                : Optional.of(registered.get(registered.size() - 1));
    }

    @Override
    public <T> List<T> getServices(Class<T> type) {
        List<Object> registered = services.get(type);
        if (registered == null) {
            return List.of();
        }
        return registered.stream().map(type::cast).toList();
    }
}
