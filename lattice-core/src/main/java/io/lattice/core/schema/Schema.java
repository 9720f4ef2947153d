package io.lattice.core.schema;

import io.lattice.core.service.ServiceProvider;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled, immutable schema owned by a request executor.
 *
 * <p>Carries the name it was built for; a cached executor's schema name always equals the
 * executor name it is cached under.
 *
 * @see SchemaBuilder
 */
public final class Schema {

    private final String name;
    private final String description;
    private final List<String> types;
    private final Map<String, Object> contextData;
    private final ServiceProvider services;

    Schema(
            String name,
            String description,
            List<String> types,
            Map<String, Object> contextData,
            ServiceProvider services) {
        this.name = name;
        this.description = description;
        this.types = List.copyOf(types);
        this.contextData = Map.copyOf(contextData);
        this.services = services;
    }

    public String getName() {
        return name;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    /**
     * Returns the registered type names in registration order.
     *
     * @return unmodifiable list, never null
     */
    public List<String> getTypes() {
        return types;
    }

    public Map<String, Object> getContextData() {
        return contextData;
    }

    /**
     * Returns the service provider attached while the schema was built.
     *
     * @return services, never null
     */
    public ServiceProvider getServices() {
        return services;
    }

    @Override
    public String toString() {
        return "Schema{name=" + name + ", types=" + types + '}';
    }
}
