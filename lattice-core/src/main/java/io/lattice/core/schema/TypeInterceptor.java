package io.lattice.core.schema;

/**
 * Hook into schema completion.
 *
 * <p>Interceptors run inside {@link SchemaBuilder#create()} in registration order.
 */
public interface TypeInterceptor {

    /**
     * Called before the schema name is completed.
     *
     * <p>The name on {@code definition} is final once all interceptors have run.
     *
     * @param definition the schema being completed, not null
     */
    default void onBeforeCompleteName(SchemaDefinition definition) {}
}
