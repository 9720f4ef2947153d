package io.lattice.core.schema;

import io.lattice.core.execution.ExecutorName;

/**
 * Forces the schema name to the executor name during name completion.
 *
 * <p>Registered by {@link SchemaAssembler} after all user actions, so it runs last among the
 * interceptors added by those actions.
 */
final class SchemaNameInterceptor implements TypeInterceptor {

    private final ExecutorName executorName;

    SchemaNameInterceptor(ExecutorName executorName) {
        this.executorName = executorName;
    }

    @Override
    public void onBeforeCompleteName(SchemaDefinition definition) {
        definition.setName(executorName.value());
    }
}
