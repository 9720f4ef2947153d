package io.lattice.core.options;

import io.lattice.core.configure.ConfigureAction;
import io.lattice.core.error.ErrorFilterFactory;
import io.lattice.core.execution.pipeline.RequestMiddleware;
import io.lattice.core.schema.Schema;
import io.lattice.core.schema.SchemaBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to build the request executor for one name.
 *
 * <p>A pre-built {@link Schema} takes precedence over the schema builder and its actions. The
 * executor options start from the optional base and are refined by the options actions. The
 * pipeline and error filters are used in list order.
 *
 * <h3>Contracts</h3>
 *
 * <ul>
 *   <li><b>Invariant</b>: immutable; all lists are unmodifiable copies
 *   <li><b>Postcondition</b>: {@link #toBuilder()} yields a builder that reproduces this
 *       instance
 * </ul>
 *
 * @see FactoryOptionsMonitor for per-name lookup
 */
public final class ExecutorFactoryOptions {

    private static final ExecutorFactoryOptions EMPTY = builder().build();

    private final Schema schema;
    private final SchemaBuilder schemaBuilder;
    private final List<ConfigureAction<SchemaBuilder>> schemaBuilderActions;
    private final ExecutorOptions executorOptions;
    private final List<ConfigureAction<ExecutorOptions>> executorOptionsActions;
    private final List<RequestMiddleware> pipeline;
    private final List<ErrorFilterFactory> errorFilters;

    private ExecutorFactoryOptions(Builder builder) {
        this.schema = builder.schema;
        this.schemaBuilder = builder.schemaBuilder;
        this.schemaBuilderActions = List.copyOf(builder.schemaBuilderActions);
        this.executorOptions = builder.executorOptions;
        this.executorOptionsActions = List.copyOf(builder.executorOptionsActions);
        this.pipeline = List.copyOf(builder.pipeline);
        this.errorFilters = List.copyOf(builder.errorFilters);
    }

    /**
     * Returns options without any configuration.
     *
     * @return shared empty instance, never null
     */
    public static ExecutorFactoryOptions empty() {
        return EMPTY;
    }

    public Optional<Schema> getSchema() {
        return Optional.ofNullable(schema);
    }

    public Optional<SchemaBuilder> getSchemaBuilder() {
        return Optional.ofNullable(schemaBuilder);
    }

    public List<ConfigureAction<SchemaBuilder>> getSchemaBuilderActions() {
        return schemaBuilderActions;
    }

    public Optional<ExecutorOptions> getExecutorOptions() {
        return Optional.ofNullable(executorOptions);
    }

    public List<ConfigureAction<ExecutorOptions>> getExecutorOptionsActions() {
        return executorOptionsActions;
    }

    public List<RequestMiddleware> getPipeline() {
        return pipeline;
    }

    public List<ErrorFilterFactory> getErrorFilters() {
        return errorFilters;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.schema = schema;
        builder.schemaBuilder = schemaBuilder;
        builder.schemaBuilderActions.addAll(schemaBuilderActions);
        builder.executorOptions = executorOptions;
        builder.executorOptionsActions.addAll(executorOptionsActions);
        builder.pipeline.addAll(pipeline);
        builder.errorFilters.addAll(errorFilters);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Schema schema;
        private SchemaBuilder schemaBuilder;
        private final List<ConfigureAction<SchemaBuilder>> schemaBuilderActions = new ArrayList<>();
        private ExecutorOptions executorOptions;
        private final List<ConfigureAction<ExecutorOptions>> executorOptionsActions =
                new ArrayList<>();
        private final List<RequestMiddleware> pipeline = new ArrayList<>();
        private final List<ErrorFilterFactory> errorFilters = new ArrayList<>();

        private Builder() {}

        public Builder schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        public Builder schemaBuilder(SchemaBuilder schemaBuilder) {
            this.schemaBuilder = schemaBuilder;
            return this;
        }

        public Builder addSchemaBuilderAction(ConfigureAction<SchemaBuilder> action) {
            schemaBuilderActions.add(Objects.requireNonNull(action, "action"));
            return this;
        }

        public Builder executorOptions(ExecutorOptions executorOptions) {
            this.executorOptions = executorOptions;
            return this;
        }

        public Builder addExecutorOptionsAction(ConfigureAction<ExecutorOptions> action) {
            executorOptionsActions.add(Objects.requireNonNull(action, "action"));
            return this;
        }

        /**
         * Removes a previously added options action.
         *
         * @param action the action to remove, compared with {@code equals}
         * @return this builder
         */
        public Builder removeExecutorOptionsAction(ConfigureAction<ExecutorOptions> action) {
            executorOptionsActions.remove(action);
            return this;
        }

        public Builder addMiddleware(RequestMiddleware middleware) {
            pipeline.add(Objects.requireNonNull(middleware, "middleware"));
            return this;
        }

        /**
         * Replaces the whole pipeline definition.
         *
         * @param middleware ordered middleware, not null
         * @return this builder
         */
        public Builder pipeline(List<RequestMiddleware> middleware) {
            pipeline.clear();
            middleware.forEach(this::addMiddleware);
            return this;
        }

        public Builder addErrorFilter(ErrorFilterFactory factory) {
            errorFilters.add(Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public ExecutorFactoryOptions build() {
            return new ExecutorFactoryOptions(this);
        }
    }
}
