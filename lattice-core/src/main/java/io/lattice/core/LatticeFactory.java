package io.lattice.core;

import io.lattice.core.diagnostics.AggregateDiagnosticEvents;
import io.lattice.core.diagnostics.DiagnosticEvents;
import io.lattice.core.diagnostics.LoggingDiagnosticEvents;
import io.lattice.core.execution.DefaultRequestExecutorResolver;
import io.lattice.core.execution.RequestExecutorListener;
import io.lattice.core.options.FactoryOptionsMonitor;
import io.lattice.core.options.InMemoryFactoryOptionsMonitor;
import io.lattice.core.service.DefaultServiceProvider;
import io.lattice.core.service.ServiceProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Factory for creating and wiring Lattice environments.
 *
 * <p>Provides static factory methods and a fluent {@link Builder} for constructing a {@link
 * LatticeEnvironment}: options monitor, service provider, diagnostics, the resolver and its
 * asynchronous build pool.
 *
 * <h3>Usage Patterns</h3>
 *
 * <pre>{@code
 * InMemoryFactoryOptionsMonitor monitor = new InMemoryFactoryOptionsMonitor();
 * monitor.configure(ExecutorName.of("catalog"), options -> options
 *         .addSchemaBuilderAction(ConfigureAction.of(schema -> schema.addType("Product"))));
 *
 * try (LatticeEnvironment env = LatticeFactory.builder()
 *         .optionsMonitor(monitor)
 *         .services(services)
 *         .build()) {
 *     RequestExecutor executor = env.getResolver().getRequestExecutor(ExecutorName.of("catalog"));
 * }
 * }</pre>
 *
 * @see LatticeEnvironment
 * @see LatticeConfig
 */
public final class LatticeFactory {

    private LatticeFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates an environment with default configuration, an empty in-memory options monitor and
     * an empty service provider.
     *
     * @return a fully-configured environment, never null
     */
    public static LatticeEnvironment createEnvironment() {
        return createEnvironment(new LatticeConfig());
    }

    /**
     * Creates an environment with custom configuration.
     *
     * @param config configuration options, not null
     * @return a fully-configured environment, never null
     */
    public static LatticeEnvironment createEnvironment(LatticeConfig config) {
        return builder().config(config).build();
    }

    /**
     * Creates an environment from explicit collaborators.
     *
     * @apiNote <b>Side effects</b>: creates a new fixed thread pool sized by {@link
     *     LatticeConfig#getThreadPoolSize()}.
     * @param config configuration options, not null
     * @param optionsMonitor source of per-name options, not null
     * @param services service provider forwarded to builds, not null
     * @param diagnostics additional diagnostic sinks, not null (may be empty)
     * @param listeners lifecycle listeners registered on the resolver, not null (may be empty)
     * @return a fully-configured environment, never null
     */
    public static LatticeEnvironment createEnvironment(
            LatticeConfig config,
            FactoryOptionsMonitor optionsMonitor,
            ServiceProvider services,
            List<DiagnosticEvents> diagnostics,
            List<RequestExecutorListener> listeners) {
        ExecutorService executorService = Executors.newFixedThreadPool(config.getThreadPoolSize());

        DefaultRequestExecutorResolver resolver =
                new DefaultRequestExecutorResolver(
                        optionsMonitor,
                        services,
                        createDiagnosticEvents(config, diagnostics),
                        executorService,
                        config.getBuildLockPollInterval());
        listeners.forEach(resolver::addListener);

        return new LatticeEnvironment(resolver, optionsMonitor, services, executorService);
    }

    private static DiagnosticEvents createDiagnosticEvents(
            LatticeConfig config, List<DiagnosticEvents> diagnostics) {
        List<DiagnosticEvents> sinks = new ArrayList<>();
        if (config.isLogDiagnostics()) {
            sinks.add(new LoggingDiagnosticEvents());
        }
        sinks.addAll(diagnostics);

        if (sinks.isEmpty()) {
            return DiagnosticEvents.NOOP;
        }
        return new AggregateDiagnosticEvents(sinks);
    }

    /**
     * Creates a new builder for fluent environment construction.
     *
     * @return a new builder instance, never null
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder for {@link LatticeEnvironment}. */
    public static final class Builder {
        private LatticeConfig config = new LatticeConfig();
        private FactoryOptionsMonitor optionsMonitor;
        private ServiceProvider services;
        private final List<DiagnosticEvents> diagnostics = new ArrayList<>();
        private final List<RequestExecutorListener> listeners = new ArrayList<>();

        private Builder() {}

        public Builder config(LatticeConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Sets the configuration source. Defaults to a new {@link InMemoryFactoryOptionsMonitor}.
         *
         * @param optionsMonitor the monitor, not null
         * @return this builder
         */
        public Builder optionsMonitor(FactoryOptionsMonitor optionsMonitor) {
            this.optionsMonitor = Objects.requireNonNull(optionsMonitor, "optionsMonitor");
            return this;
        }

        /**
         * Sets the service provider. Defaults to an empty {@link DefaultServiceProvider}.
         *
         * @param services the provider, not null
         * @return this builder
         */
        public Builder services(ServiceProvider services) {
            this.services = Objects.requireNonNull(services, "services");
            return this;
        }

        public Builder addDiagnosticEvents(DiagnosticEvents diagnosticEvents) {
            diagnostics.add(Objects.requireNonNull(diagnosticEvents, "diagnosticEvents"));
            return this;
        }

        public Builder addListener(RequestExecutorListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public LatticeEnvironment build() {
            return createEnvironment(
                    config,
                    optionsMonitor != null ? optionsMonitor : new InMemoryFactoryOptionsMonitor(),
                    services != null ? services : new DefaultServiceProvider(),
                    diagnostics,
                    listeners);
        }
    }
}
