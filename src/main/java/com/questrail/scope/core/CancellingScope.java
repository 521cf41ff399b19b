package com.questrail.scope.core;

import com.questrail.scope.api.CancelReason;
import com.questrail.scope.api.Cancellable;
import com.questrail.scope.api.CancellableScope;
import com.questrail.scope.api.Deadline;
import com.questrail.scope.internal.signal.Signal;
import com.questrail.scope.internal.signal.Termination;
import com.questrail.scope.internal.time.DeadlineClock;
import com.questrail.scope.observability.ScopeErrorEvent;
import com.questrail.scope.observability.ScopeFiredEvent;

import java.util.Objects;

/**
 * CancellingScope
 * =============================================================================
 * Scope node with its own {@link Signal}, produced by {@code withCancel},
 * {@code withTimeout} and {@code withDeadline}.
 *
 * <h2>Fire routes</h2>
 * <ul>
 *   <li>{@link #cancel()} / {@link #close()}: {@link CancelReason#CANCELED}</li>
 *   <li>own deadline timer: {@link CancelReason#DEADLINE_EXCEEDED}</li>
 *   <li>ancestor fire: the ancestor's reason and cause</li>
 * </ul>
 * Whichever route transitions the signal first wins; the rest are no-ops.
 *
 * <h2>Teardown</h2>
 * Every winning fire, whatever its route, disarms the deadline timer and drops
 * the subscription on the ancestor's signal. No timer or subscription outlives
 * the fire.
 *
 * <h2>Visibility</h2>
 * Reads go through {@link AbstractScope#termination()}, which fires this scope
 * on the spot if an ancestor already fired, so a reader never sees it active
 * after its ancestor is observably fired.
 */
final class CancellingScope extends AbstractScope implements CancellableScope {

    private final Signal signal;
    private final Deadline ownDeadline;
    private final DeadlineClock deadlineClock;

    private volatile Cancellable parentLink;

    private CancellingScope(AbstractScope parent, Deadline ownDeadline) {
        super(parent);
        this.signal = new Signal(this::reportSubscriberFailure);
        this.ownDeadline = ownDeadline;
        this.deadlineClock = ownDeadline == null
                ? null
                : new DeadlineClock(environment().clock(), environment().scheduler());
    }

    /**
     * Creates a child of {@code parent}, subscribes it to the nearest firing
     * ancestor and arms its deadline, if any.
     *
     * @param ownDeadline deadline to arm, or {@code null} for none
     */
    static CancellingScope attach(AbstractScope parent, Deadline ownDeadline) {
        CancellingScope scope = new CancellingScope(parent, ownDeadline);
        scope.linkToParent();
        if (scope.deadlineClock != null) {
            scope.deadlineClock.arm(ownDeadline, scope::expire);
        }
        return scope;
    }

    private void linkToParent() {
        Signal parentSignal = parent().cancellationSignal();
        if (parentSignal == null) {
            return;
        }
        Cancellable link = parentSignal.onFire(() -> inherit(parentSignal.termination()));
        parentLink = link;
        // Fired while linking; fire() may have missed the link.
        if (signal.isFired()) {
            link.cancel();
        }
    }

    @Override
    Signal ownSignal() {
        return signal;
    }

    @Override
    Deadline ownDeadline() {
        return ownDeadline;
    }

    @Override
    void inherit(Termination inherited) {
        fire(inherited.reason(), inherited.cause(), true);
    }

    @Override
    public boolean cancel() {
        return fire(CancelReason.CANCELED, null, false);
    }

    @Override
    public boolean cancel(Throwable cause) {
        return fire(CancelReason.CANCELED, Objects.requireNonNull(cause, "cause"), false);
    }

    @Override
    public void close() {
        cancel();
    }

    boolean hasArmedDeadline() {
        return deadlineClock != null && deadlineClock.isArmed();
    }

    private void expire() {
        fire(CancelReason.DEADLINE_EXCEEDED, null, false);
    }

    private boolean fire(CancelReason reason, Throwable cause, boolean propagated) {
        if (!signal.fire(reason, cause)) {
            return false;
        }
        if (deadlineClock != null) {
            deadlineClock.disarm();
        }
        Cancellable link = parentLink;
        if (link != null) {
            link.cancel();
        }
        ScopeEnvironment env = environment();
        env.observabilitySink().onScopeFired(
                new ScopeFiredEvent(env.wallClock().now(), scopeId(), reason, cause, propagated));
        return true;
    }

    private void reportSubscriberFailure(RuntimeException failure) {
        ScopeEnvironment env = environment();
        env.observabilitySink().onError(
                new ScopeErrorEvent(env.wallClock().now(), scopeId(), "fire subscriber failed", failure));
    }
}
