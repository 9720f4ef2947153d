package io.lattice.core.concurrent;

import io.lattice.core.exception.BuildCancelledException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Blocking await helpers for {@link CompletionStage}s that honor a {@link CancellationToken}.
 *
 * <p>The build path awaits asynchronous configure actions in place. Awaiting is a suspension
 * point: the wait ends as soon as either the stage completes or the token is cancelled.
 */
public final class Futures {

    private Futures() {}

    /**
     * Waits for {@code stage} to complete and returns its value.
     *
     * <h3>Contracts</h3>
     *
     * <ul>
     *   <li><b>Precondition</b>: token is not yet cancelled, otherwise fails immediately
     *   <li><b>Postcondition</b>: returns the stage value, or throws its failure
     * </ul>
     *
     * @param stage the stage to await, not null
     * @param token cancellation signal, not null
     * @param <T> the stage result type
     * @return the completed value, may be null
     * @throws BuildCancelledException if the token is cancelled before the stage completes, or
     *     if the waiting thread is interrupted
     * @throws RuntimeException the unchecked failure of the stage, unchanged
     * @throws CompletionException wrapping a checked failure of the stage
     */
    public static <T> T await(CompletionStage<T> stage, CancellationToken token) {
        token.throwIfCancellationRequested();
        CompletableFuture<T> future = stage.toCompletableFuture();

        if (!future.isDone()) {
            CompletableFuture<Object> race =
                    CompletableFuture.anyOf(future, token.whenCancelled().toCompletableFuture());
            try {
                race.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BuildCancelledException("Interrupted while awaiting", e);
            } catch (ExecutionException e) {
                // only the awaited stage can fail; the cancellation stage completes normally
                throw unwrap(new CompletionException(e.getCause()));
            }
            if (!future.isDone()) {
                throw new BuildCancelledException("Operation was cancelled");
            }
        }

        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Converts a {@link CompletionException} into the exception to rethrow.
     *
     * <p>Unchecked causes are returned unchanged. Errors are rethrown. Checked causes stay
     * wrapped.
     *
     * @param e the completion failure, not null
     * @return the exception to throw, never null
     */
    public static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }
}
