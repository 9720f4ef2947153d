package io.lattice.core.concurrent;

import io.lattice.core.exception.BuildCancelledException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cooperative cancellation signal passed through the executor build path.
 *
 * <p>A token starts un-cancelled and transitions to cancelled at most once via {@link
 * #cancel()}. Code that reaches a suspension point (awaiting an asynchronous configure action,
 * waiting for the build lock) checks the token and aborts with {@link BuildCancelledException}.
 *
 * <p>{@link #NONE} is a shared token that can never be cancelled; use it where the caller has
 * no cancellation source.
 *
 * @implNote Thread-safe. Backed by a {@link CompletableFuture} that completes on cancellation,
 *     which lets waiters race an awaited stage against the cancellation signal. Linked children
 *     are held by their parent until they are cancelled or {@link #unlink() unlinked}.
 */
public class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false, null);

    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();
    private final Set<CancellationToken> children = ConcurrentHashMap.newKeySet();
    private final boolean cancellable;
    private final CancellationToken parent;

    /** Creates a new, un-cancelled token. */
    public CancellationToken() {
        this(true, null);
    }

    private CancellationToken(boolean cancellable, CancellationToken parent) {
        this.cancellable = cancellable;
        this.parent = parent;
    }

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call transitioned the token, {@code false} if it was already
     *     cancelled
     * @throws UnsupportedOperationException if called on {@link #NONE}
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        boolean transitioned = cancelled.complete(null);
        for (CancellationToken child : children) {
            child.cancel();
        }
        unlink();
        return transitioned;
    }

    /**
     * Returns whether cancellation has been requested.
     *
     * @return {@code true} once {@link #cancel()} has been called
     */
    public boolean isCancellationRequested() {
        return cancelled.isDone();
    }

    /**
     * Throws if cancellation has been requested.
     *
     * @throws BuildCancelledException if this token is cancelled
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new BuildCancelledException("Operation was cancelled");
        }
    }

    /**
     * Returns a stage that completes when this token is cancelled.
     *
     * <p>For {@link #NONE} the stage never completes.
     *
     * @return cancellation stage, never null
     */
    public CompletionStage<Void> whenCancelled() {
        return cancelled.minimalCompletionStage();
    }

    /**
     * Creates a token that is cancelled when this token is cancelled or when {@link #cancel()}
     * is called on the returned token directly.
     *
     * <p>The child stays registered with this token until it is cancelled or {@link #unlink()}
     * is called. Linking to {@link #NONE} registers nothing.
     *
     * @return linked child token, never null
     */
    public CancellationToken link() {
        if (!cancellable) {
            return new CancellationToken();
        }
        CancellationToken child = new CancellationToken(true, this);
        children.add(child);
        if (isCancellationRequested()) {
            child.cancel();
        }
        return child;
    }

    /**
     * Detaches this token from the token it was linked from. Idempotent; a no-op for unlinked
     * tokens.
     *
     * <p>Call it once the work guarded by a linked token has finished, so a long-lived parent
     * does not retain the child.
     */
    public void unlink() {
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    /**
     * Returns how many linked children this token currently holds.
     *
     * @return number of registered children, zero for {@link #NONE}
     */
    public int getLinkedCount() {
        return children.size();
    }
}
