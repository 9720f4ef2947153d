package io.lattice.core.execution.pipeline;

import io.lattice.core.error.ErrorHandler;
import io.lattice.core.execution.ExecutorName;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.service.Activator;
import io.lattice.core.service.ServiceProvider;

/**
 * Build-time context shared by every {@link RequestMiddleware} of one executor.
 *
 * @param executorName the executor being built, not null
 * @param services the service provider, not null
 * @param activator helper factory, not null
 * @param errorHandler the executor's error handler, not null
 * @param options the resolved executor options, not null
 */
public record MiddlewareFactoryContext(
        ExecutorName executorName,
        ServiceProvider services,
        Activator activator,
        ErrorHandler errorHandler,
        ExecutorOptions options) {}
