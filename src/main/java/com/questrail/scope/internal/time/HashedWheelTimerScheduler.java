package com.questrail.scope.internal.time;

import com.questrail.scope.api.Cancellable;
import io.netty.util.Timeout;
import io.netty.util.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * HashedWheelTimerScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a Netty {@link Timer}, normally an
 * {@link io.netty.util.HashedWheelTimer}.
 *
 * <p>A hashed wheel trades precision (one tick) for O(1) arm and disarm, which
 * suits trees where most deadline timers are disarmed long before they expire.</p>
 *
 * <p>Like {@link ScheduledExecutorScheduler}, this class does not own the timer;
 * the creator calls {@link Timer#stop()}.</p>
 */
public final class HashedWheelTimerScheduler implements MonotonicScheduler {

    private final Timer timer;
    private final MonotonicClock clock;

    public HashedWheelTimerScheduler(Timer timer, MonotonicClock clock) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }
}
