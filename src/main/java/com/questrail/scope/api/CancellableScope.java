package com.questrail.scope.api;

/**
 * CancellableScope
 * -----------------------------------------------------------------------------
 * A {@link Scope} together with its cancel function, as returned by
 * {@code withCancel}, {@code withTimeout} and {@code withDeadline}.
 *
 * <h2>Release obligation</h2>
 * Whoever derives a cancellable scope must release it on every exit path,
 * including success. Releasing detaches the scope from its parent and disarms
 * its deadline timer. Forgetting to do so does not break correctness but leaks
 * a propagation subscription (and possibly a timer) until an ancestor fires.
 *
 * <pre>{@code
 * try (CancellableScope scope = Scopes.withTimeout(parent, Duration.ofSeconds(5))) {
 *     worker.run(scope);
 * }
 * }</pre>
 *
 * <p>{@link #cancel()} and {@link #close()} are idempotent. If the scope already
 * fired through another route (deadline, parent) they are no-ops and the
 * recorded reason does not change.</p>
 */
public interface CancellableScope extends Scope, AutoCloseable
{
    /**
     * Fires this scope with {@link CancelReason#CANCELED} unless it already
     * fired.
     *
     * @return {@code true} if this call performed the transition
     */
    boolean cancel();

    /**
     * Like {@link #cancel()} and attaches {@code cause}, which descendants
     * report through {@link Scope#cause()}.
     */
    boolean cancel(Throwable cause);

    /**
     * Same as {@link #cancel()}; lets the scope be used in try-with-resources.
     */
    @Override
    void close();
}
