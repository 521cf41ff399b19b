package com.questrail.scope.internal.time;

import com.questrail.scope.api.Cancellable;
import com.questrail.scope.api.Deadline;

import java.util.Objects;

/**
 * DeadlineClock
 * =============================================================================
 * Holds the single pending timer of one scope.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one timer is ever armed per clock.</li>
 *   <li>A deadline that is not in the future fires synchronously inside
 *       {@link #arm(Deadline, Runnable)}; no timer is scheduled for it.</li>
 *   <li>Once {@link #disarm()} has been called, no timer stays armed, even if
 *       the disarm races an arm in progress.</li>
 * </ul>
 */
public final class DeadlineClock {

    private static final Cancellable DISARMED = Cancellable.NOOP;

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;

    // null: never armed; DISARMED: released; otherwise the live timer handle.
    private Cancellable pending;

    public DeadlineClock(MonotonicClock clock, MonotonicScheduler scheduler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Arms the clock so {@code onExpiry} runs when {@code deadline} elapses.
     *
     * @return {@code true} if a timer was scheduled, {@code false} if the
     *         deadline had already passed and {@code onExpiry} ran inline, or
     *         the clock was already disarmed
     * @throws IllegalStateException if the clock was armed before
     */
    public boolean arm(Deadline deadline, Runnable onExpiry) {
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(onExpiry, "onExpiry");

        synchronized (this) {
            if (pending == DISARMED) {
                return false;
            }
            if (pending != null) {
                throw new IllegalStateException("deadline clock already armed");
            }
            if (deadline.isExpired(clock)) {
                pending = DISARMED;
            } else {
                pending = scheduler.scheduleAtNanos(deadline.nanos(), onExpiry);
                return true;
            }
        }
        onExpiry.run();
        return false;
    }

    /**
     * Cancels the pending timer, if any. Idempotent.
     *
     * @return {@code true} if a live timer was cancelled by this call
     */
    public boolean disarm() {
        Cancellable toCancel;
        synchronized (this) {
            toCancel = pending;
            pending = DISARMED;
        }
        return toCancel != null && toCancel != DISARMED && toCancel.cancel();
    }

    public synchronized boolean isArmed() {
        return pending != null && pending != DISARMED;
    }
}
