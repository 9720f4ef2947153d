package io.lattice.core.service;

import java.util.List;
import java.util.Optional;

/**
 * Opaque service lookup handed to configure actions, middleware factories and error filter
 * factories.
 *
 * <p>The executor build path forwards this capability without inspecting it. The only lookup
 * the build path performs itself is {@link #getServices(Class)} for globally registered error
 * filters.
 *
 * @implNote Implementations must be thread-safe. Executors resolved concurrently share one
 *     provider.
 * @see DefaultServiceProvider
 */
public interface ServiceProvider {

    /**
     * Returns the service registered for {@code type}.
     *
     * <p>When several instances are registered, the most recently registered one wins.
     *
     * @param type the service type, not null
     * @param <T> the service type
     * @return the service, or empty if none is registered
     */
    <T> Optional<T> getService(Class<T> type);

    /**
     * Returns all services registered for {@code type}, in registration order.
     *
     * @param type the service type, not null
     * @param <T> the service type
     * @return unmodifiable list, never null (may be empty)
     */
    <T> List<T> getServices(Class<T> type);

    /**
     * Returns the service registered for {@code type} or throws.
     *
     * @param type the service type, not null
     * @param <T> the service type
     * @return the service, never null
     * @throws IllegalStateException if no service is registered for {@code type}
     */
    default <T> T getRequiredService(Class<T> type) {
        return getService(type)
                .orElseThrow(
                        () ->
                                new IllegalStateException(
                                        "No service registered for type: " + type.getName()));
    }

    /** Provider without any services. */
    ServiceProvider EMPTY =
            new ServiceProvider() {
                @Override
                public <T> Optional<T> getService(Class<T> type) {
                    return Optional.empty();
                }

                @Override
                public <T> List<T> getServices(Class<T> type) {
                    return List.of();
                }
            };
}
