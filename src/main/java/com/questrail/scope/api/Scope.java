package com.questrail.scope.api;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Scope
 * -----------------------------------------------------------------------------
 * A node in the cancellation / deadline / value tree. A {@code Scope} represents
 * the lifetime of one logical operation and is passed explicitly, as the first
 * parameter, to every function that takes part in that operation.
 *
 * <h2>Observing</h2>
 * A scope is either <em>active</em> or <em>fired</em>. Once fired it never
 * becomes active again, and its {@link #err()} is permanently one of
 * {@link CancelReason#CANCELED} or {@link CancelReason#DEADLINE_EXCEEDED}.
 * A scope counts as fired as soon as any ancestor has fired.
 *
 * <h2>Worker contract</h2>
 * A worker given a scope must race every blocking step against the scope:
 * proceed if the work completes first, abandon and report {@link #err()} if the
 * scope fires first. A worker that blocks on work without observing the scope
 * defeats cancellation. See {@code ScopedWork} for the race helpers.
 *
 * <h2>Mutation</h2>
 * Workers never mutate a scope. Only the holder of a {@link CancellableScope}
 * can fire it, and only derivation creates new scopes.
 *
 * <h2>Thread Safety</h2>
 * All methods are safe to call from any thread.
 */
public interface Scope
{
    /**
     * Completion stage that completes with the terminal reason when this scope
     * fires. For scopes that can never fire the stage never completes.
     *
     * <p>The returned stage is a shared read-only view; it cannot be used to
     * fire the scope.</p>
     */
    CompletionStage<CancelReason> done();

    /**
     * Terminal reason, or empty while the scope is active.
     */
    Optional<CancelReason> err();

    /**
     * Optional cause attached by {@link CancellableScope#cancel(Throwable)} on
     * this scope or the ancestor whose fire reached it.
     */
    Optional<Throwable> cause();

    /**
     * Effective deadline: the earliest deadline of this scope and all of its
     * ancestors, or empty if none of them has one.
     */
    Optional<Deadline> deadline();

    /**
     * Time left until the effective deadline; negative once it has passed.
     */
    Optional<Duration> timeRemaining();

    /**
     * Looks up the value bound to {@code key} on this scope or the nearest
     * ancestor that binds it, falling back to the key's default.
     */
    <T> Optional<T> value(ScopeKey<T> key);

    /**
     * Blocks until this scope fires. Returns immediately if it already has.
     *
     * @return the terminal reason
     * @throws InterruptedException if the waiting thread is interrupted
     */
    CancelReason await() throws InterruptedException;

    /**
     * Blocks until this scope fires or {@code timeout} elapses.
     *
     * @return {@code true} if the scope fired within the timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean await(Duration timeout) throws InterruptedException;

    /**
     * Registers {@code listener} to run synchronously in the firing thread when
     * this scope fires, or immediately on the calling thread if it already has.
     * Listeners must be short and non-blocking.
     *
     * @return a handle that removes the listener; it reports {@code false} if
     *         the listener already ran
     */
    Cancellable onDone(Runnable listener);

    /**
     * Convenience for {@code err().isPresent()}.
     */
    default boolean isDone() {
        return err().isPresent();
    }

    /**
     * Checkpoint for cooperative loops.
     *
     * @throws ScopeCancelledException if this scope has fired
     */
    default void throwIfDone() {
        Optional<CancelReason> reason = err();
        if (reason.isPresent()) {
            throw new ScopeCancelledException(reason.get(), cause().orElse(null));
        }
    }
}
