package io.lattice.core.error;

import io.lattice.core.options.ExecutorFactoryOptions;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.service.ServiceProvider;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the error filters an executor's {@link ErrorHandler} applies.
 *
 * <p>Order: one filter per {@link ErrorFilterFactory} registered for the executor, in
 * registration order, followed by every {@link ErrorFilter} registered globally with the
 * {@link ServiceProvider}. Executor-specific filters therefore see an error before global ones.
 */
public final class ErrorFilterAggregator {

    private ErrorFilterAggregator() {}

    /**
     * Creates the ordered filter list.
     *
     * @param options factory options of the executor being built, not null
     * @param executorOptions the resolved executor options, not null
     * @param services the service provider, not null
     * @return new list, never null (may be empty)
     */
    public static List<ErrorFilter> collect(
            ExecutorFactoryOptions options,
            ExecutorOptions executorOptions,
            ServiceProvider services) {
        List<ErrorFilter> filters = new ArrayList<>();
        for (ErrorFilterFactory factory : options.getErrorFilters()) {
            filters.add(factory.create(services, executorOptions));
        }
        filters.addAll(services.getServices(ErrorFilter.class));
        return filters;
    }
}
