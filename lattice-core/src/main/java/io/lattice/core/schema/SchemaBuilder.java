package io.lattice.core.schema;

import io.lattice.core.execution.ExecutorName;
import io.lattice.core.service.ServiceProvider;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable builder producing a {@link Schema}.
 *
 * <p>Configure actions registered for an executor name mutate a builder in order; setters
 * overwrite previous values, so the last action to set a field wins.
 *
 * @implNote <b>Not thread-safe</b>. The executor build path works on a {@link #copy()} so a
 *     configured builder can be reused across rebuilds.
 */
public class SchemaBuilder {

    private String name;
    private String description;
    private final List<String> types = new ArrayList<>();
    private final Map<String, Object> contextData = new LinkedHashMap<>();
    private final List<TypeInterceptor> interceptors = new ArrayList<>();
    private ServiceProvider services;

    /** Creates an empty builder. */
    public SchemaBuilder() {}

    public SchemaBuilder name(String name) {
        this.name = name;
        return this;
    }

    public SchemaBuilder description(String description) {
        this.description = description;
        return this;
    }

    /**
     * Registers a type by name.
     *
     * @param typeName the type name, not null
     * @return this builder
     */
    public SchemaBuilder addType(String typeName) {
        types.add(Objects.requireNonNull(typeName, "typeName"));
        return this;
    }

    public SchemaBuilder setContextData(String key, Object value) {
        contextData.put(
                Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public SchemaBuilder addTypeInterceptor(TypeInterceptor interceptor) {
        interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
        return this;
    }

    /**
     * Attaches the service provider the schema will expose.
     *
     * @param services the provider, not null
     * @return this builder
     */
    public SchemaBuilder addServices(ServiceProvider services) {
        this.services = Objects.requireNonNull(services, "services");
        return this;
    }

    public String getName() {
        return name;
    }

    public List<String> getTypes() {
        return List.copyOf(types);
    }

    public Map<String, Object> getContextData() {
        return Map.copyOf(contextData);
    }

    /**
     * Returns a detached builder with the same state.
     *
     * @return new builder, never null
     */
    public SchemaBuilder copy() {
        SchemaBuilder copy = new SchemaBuilder();
        copy.name = name;
        copy.description = description;
        copy.types.addAll(types);
        copy.contextData.putAll(contextData);
        copy.interceptors.addAll(interceptors);
        copy.services = services;
        return copy;
    }

    /**
     * Completes and freezes the schema.
     *
     * <p>Runs each registered {@link TypeInterceptor} in order. A schema that still has no name
     * afterwards is named {@link ExecutorName#DEFAULT}.
     *
     * @return the schema, never null
     * @throws IllegalStateException if a type name is registered more than once
     */
    public Schema create() {
        Set<String> seen = new HashSet<>();
        for (String type : types) {
            if (!seen.add(type)) {
                throw new IllegalStateException("Type `" + type + "` is registered twice");
            }
        }

        SchemaDefinition definition =
                new SchemaDefinition(name, description, new HashMap<>(contextData));
        for (TypeInterceptor interceptor : interceptors) {
            interceptor.onBeforeCompleteName(definition);
        }

        String completedName =
                definition.getName() == null || definition.getName().isBlank()
                        ? ExecutorName.DEFAULT.value()
                        : definition.getName();

        return new Schema(
                completedName,
                definition.getDescription(),
                types,
                definition.getContextData(),
                services == null ? ServiceProvider.EMPTY : services);
    }
}
