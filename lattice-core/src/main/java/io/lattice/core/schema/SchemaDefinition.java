package io.lattice.core.schema;

import java.util.Map;

/**
 * Mutable description of a schema while {@link SchemaBuilder#create()} completes it.
 *
 * <p>Handed to {@link TypeInterceptor}s, which may rewrite the name or context data before the
 * schema is frozen.
 */
public final class SchemaDefinition {

    private String name;
    private String description;
    private final Map<String, Object> contextData;

    SchemaDefinition(String name, String description, Map<String, Object> contextData) {
        this.name = name;
        this.description = description;
        this.contextData = contextData;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * Returns the mutable context data that will be copied into the schema.
     *
     * @return context data, never null
     */
    public Map<String, Object> getContextData() {
        return contextData;
    }
}
