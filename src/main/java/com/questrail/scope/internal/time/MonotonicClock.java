package com.questrail.scope.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for scope deadlines.
 *
 * <h2>Binding invariant</h2>
 * All deadline logic (timer arming, expiry checks, remaining time) MUST use a
 * monotonic time source. Wall-clock time (e.g. {@code Instant.now()}) is
 * permitted only to convert a caller's {@code Instant} deadline at derivation
 * time and for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful relative to each other.
     * </p>
     */
    long nowNanos();
}
