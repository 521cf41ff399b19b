package com.questrail.scope.internal.signal;

import com.questrail.scope.api.CancelReason;
import com.questrail.scope.api.Cancellable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Signal
 * =============================================================================
 * One-shot, many-reader broadcast. A signal is fired at most once and stays
 * fired; any number of threads may poll it or wait on it without blocking each
 * other.
 *
 * <h2>Linearization point</h2>
 * The compare-and-set on the termination reference. Exactly one
 * {@link #fire(CancelReason, Throwable)} call wins; every other call, earlier
 * or concurrent, is a no-op and cannot change the recorded reason.
 *
 * <h2>Fire sequence</h2>
 * <ol>
 *   <li>record the termination (CAS)</li>
 *   <li>detach the subscriber set</li>
 *   <li>run subscribers in registration order, on the firing thread</li>
 *   <li>complete the shared future, releasing waiters</li>
 * </ol>
 * Subscribers are how child scopes follow their parent, so by the time any
 * thread blocked in {@link #await()} wakes up, every live descendant has
 * already fired.
 *
 * <h2>Nested fires</h2>
 * A fire triggered from inside another fire's subscribers on the same thread
 * records its termination immediately but hands its subscribers and its
 * completion to the outermost fire, which runs them from an explicit stack.
 * Propagation through a chain of any length therefore uses constant stack
 * depth, and still completes a signal only after everything fired below it.
 *
 * <h2>Subscriber failures</h2>
 * A subscriber that throws does not stop the remaining subscribers. Runtime
 * exceptions go to the handler supplied at construction. An {@link Error} is
 * rethrown by the outermost fire once every queued subscriber has run and
 * every queued signal has completed.
 */
public final class Signal {

    // Non-null while this thread drains a fire.
    private static final ThreadLocal<Deque<Runnable>> PROPAGATION = new ThreadLocal<>();

    private final AtomicReference<Termination> termination = new AtomicReference<>();
    private final CompletableFuture<CancelReason> fired = new CompletableFuture<>();
    private final CompletionStage<CancelReason> view = fired.minimalCompletionStage();
    private final Consumer<RuntimeException> subscriberFailureHandler;

    // Guarded by this; null once detached by the winning fire.
    private Set<Subscription> subscribers = new LinkedHashSet<>();

    public Signal(Consumer<RuntimeException> subscriberFailureHandler) {
        this.subscriberFailureHandler = Objects.requireNonNull(subscriberFailureHandler, "subscriberFailureHandler");
    }

    public boolean fire(CancelReason reason) {
        return fire(reason, null);
    }

    /**
     * Fires this signal unless it already fired.
     *
     * @return {@code true} if this call recorded the termination
     */
    public boolean fire(CancelReason reason, Throwable cause) {
        Termination candidate = new Termination(reason, cause);
        if (!termination.compareAndSet(null, candidate)) {
            return false;
        }

        List<Subscription> toNotify;
        synchronized (this) {
            toNotify = new ArrayList<>(subscribers);
            subscribers = null;
        }

        Deque<Runnable> pending = PROPAGATION.get();
        if (pending != null) {
            push(pending, toNotify, reason);
            return true;
        }

        pending = new ArrayDeque<>();
        PROPAGATION.set(pending);
        try {
            push(pending, toNotify, reason);
            drain(pending);
        } finally {
            PROPAGATION.remove();
        }
        return true;
    }

    // Completion goes under the subscribers so it runs after the whole subtree.
    private void push(Deque<Runnable> pending, List<Subscription> toNotify, CancelReason reason) {
        pending.push(() -> fired.complete(reason));
        for (int i = toNotify.size() - 1; i >= 0; i--) {
            Runnable listener = toNotify.get(i).listener;
            pending.push(() -> runSubscriber(listener));
        }
    }

    private void runSubscriber(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            subscriberFailureHandler.accept(e);
        }
    }

    private static void drain(Deque<Runnable> pending) {
        Throwable failure = null;
        Runnable next;
        while ((next = pending.poll()) != null) {
            try {
                next.run();
            } catch (RuntimeException | Error e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure != null) {
            throw (Error) failure;
        }
    }

    public boolean isFired() {
        return termination.get() != null;
    }

    public Optional<CancelReason> reason() {
        return Optional.ofNullable(termination.get()).map(Termination::reason);
    }

    /**
     * The recorded termination, or {@code null} while not fired.
     */
    public Termination termination() {
        return termination.get();
    }

    /**
     * Shared read-only stage completing with the reason once waiters may be
     * released.
     */
    public CompletionStage<CancelReason> whenFired() {
        return view;
    }

    /**
     * Blocks until fired.
     */
    public CancelReason await() throws InterruptedException {
        try {
            return fired.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("signal future is never completed exceptionally", e);
        }
    }

    /**
     * Blocks until fired or the timeout elapses.
     *
     * @return {@code true} if the signal fired
     */
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (fired.isDone()) {
            return true;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            return false;
        }
        try {
            fired.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("signal future is never completed exceptionally", e);
        }
    }

    /**
     * Subscribes {@code listener} to the fire. If the signal already fired the
     * listener runs immediately on the calling thread.
     *
     * @return handle removing the subscription; {@code cancel()} reports
     *         {@code false} once the listener has been handed to a fire
     */
    public Cancellable onFire(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        Subscription subscription = new Subscription(listener);
        synchronized (this) {
            if (subscribers != null) {
                subscribers.add(subscription);
                return subscription;
            }
        }
        listener.run();
        return Cancellable.NOOP;
    }

    /**
     * Number of live subscriptions; zero once fired.
     */
    public synchronized int listenerCount() {
        return subscribers == null ? 0 : subscribers.size();
    }

    @Override
    public String toString() {
        Termination t = termination.get();
        return t == null ? "Signal[active]" : "Signal[fired: " + t.reason() + "]";
    }

    private final class Subscription implements Cancellable {
        private final Runnable listener;

        private Subscription(Runnable listener) {
            this.listener = listener;
        }

        @Override
        public boolean cancel() {
            synchronized (Signal.this) {
                return subscribers != null && subscribers.remove(this);
            }
        }
    }
}
