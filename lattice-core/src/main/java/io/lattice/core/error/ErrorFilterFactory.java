package io.lattice.core.error;

import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.service.ServiceProvider;

/** Creates an executor-specific {@link ErrorFilter} during the executor build. */
@FunctionalInterface
public interface ErrorFilterFactory {

    /**
     * Creates the filter.
     *
     * @param services the service provider, not null
     * @param options the resolved executor options, not null
     * @return the filter, not null
     */
    ErrorFilter create(ServiceProvider services, ExecutorOptions options);
}
