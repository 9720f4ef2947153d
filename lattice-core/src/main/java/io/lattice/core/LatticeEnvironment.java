package io.lattice.core;

import io.lattice.core.execution.RequestExecutorResolver;
import io.lattice.core.options.FactoryOptionsMonitor;
import io.lattice.core.service.ServiceProvider;
import java.util.concurrent.ExecutorService;

/**
 * Container holding the executor resolver and the collaborators it was wired with.
 *
 * <h3>Contracts</h3>
 *
 * <ul>
 *   <li><b>Precondition</b>: all constructor parameters must be non-null
 *   <li><b>Invariant</b>: component references are immutable after construction
 * </ul>
 *
 * @apiNote Create instances via {@link LatticeFactory#createEnvironment()} or {@link
 *     LatticeFactory.Builder} rather than direct construction.
 * @see LatticeFactory
 */
public final class LatticeEnvironment implements AutoCloseable {

    private final RequestExecutorResolver resolver;
    private final FactoryOptionsMonitor optionsMonitor;
    private final ServiceProvider services;
    private final ExecutorService executorService;

    public LatticeEnvironment(
            RequestExecutorResolver resolver,
            FactoryOptionsMonitor optionsMonitor,
            ServiceProvider services,
            ExecutorService executorService) {
        this.resolver = resolver;
        this.optionsMonitor = optionsMonitor;
        this.services = services;
        this.executorService = executorService;
    }

    public RequestExecutorResolver getResolver() {
        return resolver;
    }

    /**
     * Returns the configuration source the resolver is subscribed to.
     *
     * @return the options monitor, never null
     */
    public FactoryOptionsMonitor getOptionsMonitor() {
        return optionsMonitor;
    }

    public ServiceProvider getServices() {
        return services;
    }

    /**
     * Closes the resolver, then shuts down the asynchronous build pool.
     *
     * @apiNote <b>Side effects</b>:
     *     <ul>
     *       <li>Drops all cached executors and unsubscribes from configuration changes
     *       <li>Initiates orderly shutdown of the thread pool; no new builds are accepted
     *     </ul>
     */
    @Override
    public void close() {
        resolver.close();
        executorService.shutdown();
    }
}
