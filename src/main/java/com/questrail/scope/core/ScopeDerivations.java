package com.questrail.scope.core;

import com.questrail.scope.api.Cancellable;
import com.questrail.scope.api.CancellableScope;
import com.questrail.scope.api.Deadline;
import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeKey;
import com.questrail.scope.observability.ScopeErrorEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ScopeDerivations
 * =============================================================================
 * Constructors for scope nodes. Each takes a parent and returns a new child
 * wired with the propagation rules:
 * <ul>
 *   <li>cancel-on-parent-fire</li>
 *   <li>earliest-deadline-wins</li>
 *   <li>value shadow-and-fallback</li>
 * </ul>
 * Derivation never mutates the parent beyond adding a fire subscription that
 * the child removes when it fires.
 *
 * <p>Application code normally goes through the {@code Scopes} facade.</p>
 */
public final class ScopeDerivations {

    private ScopeDerivations() {
    }

    /**
     * Creates a root that never fires. Used by {@code ScopeRuntime} for its
     * {@code background} and {@code todo} scopes.
     */
    public static RootScope root(ScopeEnvironment environment, String name) {
        return new RootScope(environment, name);
    }

    public static CancellableScope withCancel(Scope parent) {
        return CancellingScope.attach(AbstractScope.of(parent), null);
    }

    /**
     * Child that fires with {@code DEADLINE_EXCEEDED} at {@code deadline}.
     *
     * <p>If the parent's effective deadline is already no later, no timer is
     * armed: the parent fires first and its reason propagates.</p>
     */
    public static CancellableScope withDeadline(Scope parent, Deadline deadline) {
        Objects.requireNonNull(deadline, "deadline");
        AbstractScope p = AbstractScope.of(parent);

        Optional<Deadline> inherited = p.deadline();
        if (inherited.isPresent() && !deadline.isBefore(inherited.get())) {
            return CancellingScope.attach(p, null);
        }
        return CancellingScope.attach(p, deadline);
    }

    public static CancellableScope withDeadline(Scope parent, Instant at) {
        Objects.requireNonNull(at, "at");
        AbstractScope p = AbstractScope.of(parent);
        ScopeEnvironment env = p.environment();
        return withDeadline(p, Deadline.fromInstant(at, env.wallClock(), env.clock()));
    }

    /**
     * Same as {@code withDeadline(parent, now + timeout)}.
     *
     * @throws IllegalArgumentException if {@code timeout} is negative
     */
    public static CancellableScope withTimeout(Scope parent, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        AbstractScope p = AbstractScope.of(parent);
        return withDeadline(p, Deadline.after(timeout, p.environment().clock()));
    }

    public static <T> Scope withValue(Scope parent, ScopeKey<T> key, T value) {
        return new ValueScope<>(AbstractScope.of(parent), key, value);
    }

    public static Scope withoutCancel(Scope parent) {
        return new DetachedScope(AbstractScope.of(parent));
    }

    /**
     * Runs {@code action} once on the scope's scheduler after {@code scope}
     * fires. Failures of the action are reported to the observability sink.
     *
     * @return handle whose {@code cancel()} prevents the action from running
     *         and returns {@code true}, or returns {@code false} if the action
     *         was already dispatched or stopped
     */
    public static Cancellable afterFire(Scope scope, Runnable action) {
        Objects.requireNonNull(action, "action");
        AbstractScope s = AbstractScope.of(scope);
        ScopeEnvironment env = s.environment();
        AtomicBoolean claimed = new AtomicBoolean(false);

        Cancellable subscription = s.onDone(() -> {
            if (claimed.compareAndSet(false, true)) {
                env.scheduler().scheduleAtNanos(env.clock().nowNanos(), () -> runAction(s, action));
            }
        });

        return () -> {
            boolean stopped = claimed.compareAndSet(false, true);
            subscription.cancel();
            return stopped;
        };
    }

    private static void runAction(AbstractScope scope, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            ScopeEnvironment env = scope.environment();
            env.observabilitySink().onError(
                    new ScopeErrorEvent(env.wallClock().now(), scope.scopeId(), "afterFire action failed", e));
        }
    }
}
