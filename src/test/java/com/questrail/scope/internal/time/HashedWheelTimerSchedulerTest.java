package com.questrail.scope.internal.time;

import com.questrail.scope.api.Cancellable;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HashedWheelTimerSchedulerTest
 * -----------------------------------------------------------------------------
 * The wheel fires within one tick of the deadline; uses real time with
 * generous tolerances.
 */
class HashedWheelTimerSchedulerTest {

    private HashedWheelTimer timer;
    private HashedWheelTimerScheduler scheduler;

    @BeforeEach
    void setUp() {
        timer = new HashedWheelTimer(5, TimeUnit.MILLISECONDS);
        scheduler = new HashedWheelTimerScheduler(timer, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        timer.stop();
    }

    @Test
    void taskExecutesAfterDeadline() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(30);

        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);
        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(50);

        Cancellable handle = scheduler.scheduleAtNanos(deadline, () -> executed.set(true));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());
        Thread.sleep(120);
        assertFalse(executed.get());
    }
}
