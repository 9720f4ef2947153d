package io.lattice.core.configure;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.concurrent.Futures;
import io.lattice.core.exception.BuildCancelledException;
import io.lattice.core.exception.ConfigurationActionException;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Applies an ordered list of {@link ConfigureAction}s to one target.
 *
 * <h3>Contracts</h3>
 *
 * <ul>
 *   <li><b>Invariant</b>: actions run in list order; each one, including its asynchronous part,
 *       completes before the next begins
 *   <li><b>Invariant</b>: later actions may overwrite what earlier ones set (last writer wins)
 *   <li><b>Postcondition</b>: the first failure aborts the remaining actions
 * </ul>
 */
public final class ActionSequence {

    private ActionSequence() {}

    /**
     * Applies every action to {@code target} in order.
     *
     * @param target the object to configure, not null
     * @param actions ordered actions, not null (may be empty)
     * @param token cancellation signal checked before each action and while awaiting, not null
     * @param <T> the type being configured
     * @return {@code target}, for chaining
     * @throws BuildCancelledException if the token is cancelled between or during actions
     * @throws ConfigurationActionException if an asynchronous action fails with a checked cause
     * @throws RuntimeException any unchecked failure of an action, unchanged
     */
    public static <T> T applyAll(
            T target, List<? extends ConfigureAction<T>> actions, CancellationToken token) {
        for (ConfigureAction<T> action : actions) {
            token.throwIfCancellationRequested();
            try {
                Futures.await(action.apply(target, token), token);
            } catch (CompletionException e) {
                throw new ConfigurationActionException(
                        "Configure action failed: " + e.getCause().getMessage(), e.getCause());
            }
        }
        return target;
    }
}
