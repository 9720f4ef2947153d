package io.lattice.core.execution.pipeline;

import java.util.List;

/**
 * Baseline middleware used when an executor configures no pipeline of its own.
 *
 * <p>Order:
 *
 * <ol>
 *   <li>{@link ExceptionMiddleware} - turns any failure of the rest of the chain into an error
 *       result
 *   <li>{@link TimeoutMiddleware} - bounds the remainder by the executor's execution timeout
 *   <li>{@link OperationExecutionMiddleware} - runs the operation through the registered
 *       {@link io.lattice.core.execution.OperationExecutor}
 * </ol>
 */
public final class DefaultPipeline {

    private DefaultPipeline() {}

    /**
     * Returns the baseline middleware in execution order.
     *
     * @return unmodifiable list, never null or empty
     */
    public static List<RequestMiddleware> middleware() {
        return List.of(
                new ExceptionMiddleware(),
                new TimeoutMiddleware(),
                new OperationExecutionMiddleware());
    }
}
