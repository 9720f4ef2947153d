package io.lattice.core.configure;

import io.lattice.core.concurrent.CancellationToken;
import java.util.concurrent.CompletionStage;

/**
 * Asynchronous part of a {@link ConfigureAction}.
 *
 * @param <T> the type being configured
 */
@FunctionalInterface
public interface AsyncConfigure<T> {

    /**
     * Starts configuring {@code target}.
     *
     * @param target the object to configure, not null
     * @param token cancellation signal for the running build, not null
     * @return stage completing when the configuration has been applied, not null
     */
    CompletionStage<Void> configure(T target, CancellationToken token);
}
