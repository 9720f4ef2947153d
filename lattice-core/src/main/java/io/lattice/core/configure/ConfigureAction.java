package io.lattice.core.configure;

import io.lattice.core.concurrent.CancellationToken;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * A registered mutation of a builder or options object, applied during an executor build.
 *
 * <h3>Permitted Subtypes</h3>
 *
 * <ul>
 *   <li>{@link Sync} - runs a synchronous consumer
 *   <li>{@link Async} - starts an asynchronous configuration and completes with its stage
 *   <li>{@link Both} - runs the synchronous part first, then starts the asynchronous part
 * </ul>
 *
 * <p>All variants are applied the same way: {@link #apply} returns a stage, and the caller
 * awaits it before moving on to the next action. That keeps list order strict regardless of
 * which variant an action is.
 *
 * @param <T> the type being configured
 * @see ActionSequence for ordered application
 */
public sealed interface ConfigureAction<T>
        permits ConfigureAction.Sync, ConfigureAction.Async, ConfigureAction.Both {

    /**
     * Applies this action to {@code target}.
     *
     * <p>Synchronous effects have happened by the time this method returns. Asynchronous
     * effects are complete once the returned stage completes.
     *
     * @param target the object to configure, not null
     * @param token cancellation signal, not null
     * @return completion stage of this action, never null
     */
    CompletionStage<Void> apply(T target, CancellationToken token);

    /**
     * Creates a synchronous action.
     *
     * @param action consumer applied to the target, not null
     * @param <T> the type being configured
     * @return the action, never null
     */
    static <T> ConfigureAction<T> of(Consumer<? super T> action) {
        return new Sync<>(action);
    }

    /**
     * Creates an asynchronous action.
     *
     * @param action asynchronous configuration, not null
     * @param <T> the type being configured
     * @return the action, never null
     */
    static <T> ConfigureAction<T> ofAsync(AsyncConfigure<? super T> action) {
        return new Async<>(action);
    }

    /**
     * Creates an action with both a synchronous and an asynchronous part.
     *
     * @param action consumer applied first, not null
     * @param asyncAction asynchronous configuration started after {@code action}, not null
     * @param <T> the type being configured
     * @return the action, never null
     */
    static <T> ConfigureAction<T> of(
            Consumer<? super T> action, AsyncConfigure<? super T> asyncAction) {
        return new Both<>(action, asyncAction);
    }

    /**
     * Synchronous configure action.
     *
     * @param action consumer applied to the target, not null
     * @param <T> the type being configured
     */
    record Sync<T>(Consumer<? super T> action) implements ConfigureAction<T> {

        public Sync {
            Objects.requireNonNull(action, "action");
        }

        @Override
        public CompletionStage<Void> apply(T target, CancellationToken token) {
            action.accept(target);
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Asynchronous configure action.
     *
     * @param action asynchronous configuration, not null
     * @param <T> the type being configured
     */
    record Async<T>(AsyncConfigure<? super T> action) implements ConfigureAction<T> {

        public Async {
            Objects.requireNonNull(action, "action");
        }

        @Override
        public CompletionStage<Void> apply(T target, CancellationToken token) {
            return Objects.requireNonNull(
                    action.configure(target, token), "async configure action returned null");
        }
    }

    /**
     * Configure action with a synchronous part followed by an asynchronous part.
     *
     * @param action consumer applied first, not null
     * @param asyncAction asynchronous configuration started after {@code action}, not null
     * @param <T> the type being configured
     */
    record Both<T>(Consumer<? super T> action, AsyncConfigure<? super T> asyncAction)
            implements ConfigureAction<T> {

        public Both {
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(asyncAction, "asyncAction");
        }

        @Override
        public CompletionStage<Void> apply(T target, CancellationToken token) {
            action.accept(target);
            token.throwIfCancellationRequested();
            return Objects.requireNonNull(
                    asyncAction.configure(target, token), "async configure action returned null");
        }
    }
}
