package com.questrail.scope.internal.time;

import com.questrail.scope.api.Cancellable;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timer surface used by deadline clocks and {@code afterFire} callbacks.
 *
 * <h2>Binding invariant</h2>
 * Scheduling MUST be expressed in monotonic ticks.
 * It MUST NOT be expressed in wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task         runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);
}
