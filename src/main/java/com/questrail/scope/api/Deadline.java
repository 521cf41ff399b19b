package com.questrail.scope.api;

import com.questrail.scope.internal.time.MonotonicClock;
import com.questrail.scope.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Deadline
 * =============================================================================
 * An absolute point on the monotonic time line after which a scope fires with
 * {@link CancelReason#DEADLINE_EXCEEDED}.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in monotonic nanoseconds (the time base of
 * {@link MonotonicClock#nowNanos()}). Wall-clock instants are accepted only at
 * the boundary through {@link #fromInstant(Instant, WallClock, MonotonicClock)}
 * and converted once; wall-clock jumps after that point do not move a deadline.
 *
 * <h2>Ordering</h2>
 * Comparison uses the difference of tick values, so it stays correct when the
 * underlying {@code System.nanoTime()} value wraps around.
 */
public final class Deadline implements Comparable<Deadline>
{
    private final long nanos;

    private Deadline(long nanos) {
        this.nanos = nanos;
    }

    /**
     * Deadline at the given monotonic tick.
     */
    public static Deadline atNanos(long deadlineNanos) {
        return new Deadline(deadlineNanos);
    }

    /**
     * Deadline {@code timeout} from the clock's current tick.
     *
     * @throws IllegalArgumentException if {@code timeout} is negative
     */
    public static Deadline after(Duration timeout, MonotonicClock clock) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(clock, "clock");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        return new Deadline(clock.nowNanos() + saturatedNanos(timeout));
    }

    /**
     * Converts a wall-clock instant into a monotonic deadline. Instants in the
     * past produce an already-expired deadline.
     */
    public static Deadline fromInstant(Instant at, WallClock wallClock, MonotonicClock clock) {
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(clock, "clock");

        long nowNanos = clock.nowNanos();
        Duration offset = Duration.between(wallClock.now(), at);
        return new Deadline(nowNanos + saturatedNanos(offset));
    }

    public long nanos() {
        return nanos;
    }

    public boolean isExpired(MonotonicClock clock) {
        return nanos - clock.nowNanos() <= 0;
    }

    /**
     * Time left until this deadline; negative once it has passed.
     */
    public Duration timeRemaining(MonotonicClock clock) {
        return Duration.ofNanos(nanos - clock.nowNanos());
    }

    public boolean isBefore(Deadline other) {
        return compareTo(other) < 0;
    }

    /**
     * Returns whichever of the two deadlines comes first.
     */
    public Deadline earliest(Deadline other) {
        Objects.requireNonNull(other, "other");
        return isBefore(other) ? this : other;
    }

    @Override
    public int compareTo(Deadline other) {
        return Long.compare(nanos - other.nanos, 0L);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Deadline)) {
            return false;
        }
        return nanos == ((Deadline) o).nanos;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(nanos);
    }

    @Override
    public String toString() {
        return "Deadline[" + nanos + "ns]";
    }

    // Durations beyond ~292 years do not fit in a long of nanoseconds.
    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE / 2 : Long.MAX_VALUE / 2;
        }
    }
}
