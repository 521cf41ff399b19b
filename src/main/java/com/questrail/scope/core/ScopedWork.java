package com.questrail.scope.core;

import com.questrail.scope.api.Cancellable;
import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeCancelledException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * ScopedWork
 * =============================================================================
 * Race primitives for workers: each blocking step finishes either because the
 * work completed or because the scope fired, whichever happens first.
 *
 * <p>Abandonment is always reported as a {@link ScopeCancelledException}
 * carrying the scope's reason, so a worker can never silently succeed after
 * its scope fired.</p>
 */
public final class ScopedWork {

    private ScopedWork() {
    }

    /**
     * Sleeps for {@code duration} unless the scope fires first.
     *
     * @throws ScopeCancelledException if the scope fired before the duration elapsed
     * @throws InterruptedException     if the thread is interrupted
     */
    public static void sleep(Scope scope, Duration duration) throws InterruptedException {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(duration, "duration");
        scope.throwIfDone();
        if (scope.await(duration)) {
            throw cancelled(scope);
        }
    }

    /**
     * Waits for {@code work} unless the scope fires first. The work itself is
     * not cancelled; cancellation is advisory. An abandoned wait leaves no
     * completion registered on {@code work}, so a long-lived future can be
     * awaited repeatedly.
     *
     * @return the work's result
     * @throws ScopeCancelledException if the scope fired before the work completed
     * @throws ExecutionException      if the work completed exceptionally
     * @throws InterruptedException    if the thread is interrupted
     */
    public static <T> T await(Scope scope, CompletableFuture<T> work)
            throws InterruptedException, ExecutionException
    {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(work, "work");

        if (!work.isDone()) {
            CompletableFuture<T> scopeFired = new CompletableFuture<>();
            Cancellable link = scope.onDone(() -> scopeFired.complete(null));
            // Completing either side unlinks the completion left on the other.
            // A work failure is rethrown by work.get() below.
            CompletableFuture<Void> settled = work.acceptEither(scopeFired, ignored -> { })
                    .exceptionally(failure -> null);
            try {
                settled.get();
            } finally {
                link.cancel();
            }
        }

        if (work.isDone()) {
            return work.get();
        }
        throw cancelled(scope);
    }

    private static ScopeCancelledException cancelled(Scope scope) {
        return new ScopeCancelledException(
                scope.err().orElseThrow(() -> new IllegalStateException("scope has not fired")),
                scope.cause().orElse(null));
    }
}
