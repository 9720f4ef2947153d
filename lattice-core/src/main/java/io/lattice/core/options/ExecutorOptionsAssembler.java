package io.lattice.core.options;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.configure.ActionSequence;
import io.lattice.core.configure.ConfigureAction;
import java.util.List;

/**
 * Resolves the {@link ExecutorOptions} of an executor build.
 *
 * <p>Starts from a copy of the configured base options, or from defaults, and applies every
 * options action in list order. The configured base is never mutated.
 */
public final class ExecutorOptionsAssembler {

    private ExecutorOptionsAssembler() {}

    /**
     * Resolves options.
     *
     * @param base configured base options, may be null
     * @param actions ordered options actions, not null (may be empty)
     * @param token cancellation signal, not null
     * @return fresh resolved options, never null
     * @see ActionSequence#applyAll for ordering and failure semantics
     */
    public static ExecutorOptions resolve(
            ExecutorOptions base,
            List<ConfigureAction<ExecutorOptions>> actions,
            CancellationToken token) {
        ExecutorOptions options = base == null ? new ExecutorOptions() : base.copy();
        return ActionSequence.applyAll(options, actions, token);
    }

    /**
     * Resolves the options described by {@code factoryOptions}.
     *
     * @param factoryOptions the factory options, not null
     * @param token cancellation signal, not null
     * @return fresh resolved options, never null
     */
    public static ExecutorOptions resolve(
            ExecutorFactoryOptions factoryOptions, CancellationToken token) {
        return resolve(
                factoryOptions.getExecutorOptions().orElse(null),
                factoryOptions.getExecutorOptionsActions(),
                token);
    }
}
