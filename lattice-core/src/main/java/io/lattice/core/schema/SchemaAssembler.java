package io.lattice.core.schema;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.configure.ActionSequence;
import io.lattice.core.exception.SchemaNameMismatchException;
import io.lattice.core.execution.ExecutorName;
import io.lattice.core.options.ExecutorFactoryOptions;
import io.lattice.core.service.ServiceProvider;
import java.util.Optional;

/**
 * Produces the {@link Schema} of an executor build.
 *
 * <h3>Resolution</h3>
 *
 * <ol>
 *   <li>A pre-built schema in the factory options is validated and returned unchanged. No
 *       builder actions run.
 *   <li>Otherwise a copy of the configured builder (or a fresh builder) is configured by the
 *       schema builder actions in order, gets a {@link SchemaNameInterceptor} and the service
 *       provider, and is created.
 * </ol>
 *
 * <h3>Contracts</h3>
 *
 * <ul>
 *   <li><b>Postcondition</b>: the returned schema's name equals the requested executor name
 *   <li><b>Invariant</b>: the configured builder is never mutated
 * </ul>
 */
public final class SchemaAssembler {

    private final ServiceProvider services;

    public SchemaAssembler(ServiceProvider services) {
        this.services = services;
    }

    /**
     * Resolves the schema for {@code name}.
     *
     * @param name the executor name, not null
     * @param options the executor's factory options, not null
     * @param token cancellation signal, not null
     * @return the schema, never null
     * @throws SchemaNameMismatchException if the resulting schema is named differently
     */
    public Schema resolve(ExecutorName name, ExecutorFactoryOptions options, CancellationToken token) {
        Optional<Schema> prebuilt = options.getSchema();
        if (prebuilt.isPresent()) {
            assertSchemaName(prebuilt.get(), name);
            return prebuilt.get();
        }

        SchemaBuilder builder =
                options.getSchemaBuilder().map(SchemaBuilder::copy).orElseGet(SchemaBuilder::new);

        ActionSequence.applyAll(builder, options.getSchemaBuilderActions(), token);

        builder.addTypeInterceptor(new SchemaNameInterceptor(name)).addServices(services);

        token.throwIfCancellationRequested();
        Schema schema = builder.create();
        assertSchemaName(schema, name);
        return schema;
    }

    private static void assertSchemaName(Schema schema, ExecutorName expected) {
        if (!expected.value().equals(schema.getName())) {
            throw new SchemaNameMismatchException(expected, schema.getName());
        }
    }
}
