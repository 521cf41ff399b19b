package com.questrail.scope.internal.time;

import com.questrail.scope.api.Deadline;
import com.questrail.scope.time.DeterministicScheduler;
import com.questrail.scope.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeadlineClockTest
 * -----------------------------------------------------------------------------
 * Fully deterministic: manual clock, tasks run only on runDueTasks().
 */
class DeadlineClockTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private DeadlineClock deadlineClock;
    private final AtomicInteger expiries = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        deadlineClock = new DeadlineClock(clock, scheduler);
    }

    @Test
    void firesAtDeadline() {
        assertTrue(deadlineClock.arm(Deadline.atNanos(1_000_000_000L), expiries::incrementAndGet));
        assertTrue(deadlineClock.isArmed());

        clock.advanceMillis(999);
        scheduler.runDueTasks();
        assertEquals(0, expiries.get());

        clock.advanceMillis(1);
        scheduler.runDueTasks();
        assertEquals(1, expiries.get());
    }

    @Test
    void pastDeadlineFiresInlineWithoutTimer() {
        clock.advanceMillis(10);

        assertFalse(deadlineClock.arm(Deadline.atNanos(0), expiries::incrementAndGet));

        assertEquals(1, expiries.get());
        assertEquals(0, scheduler.pendingCount());
        assertFalse(deadlineClock.isArmed());
    }

    @Test
    void disarmCancelsPendingTimerAndIsIdempotent() {
        deadlineClock.arm(Deadline.atNanos(5_000), expiries::incrementAndGet);
        assertEquals(1, scheduler.pendingCount());

        assertTrue(deadlineClock.disarm());
        assertFalse(deadlineClock.disarm());
        assertEquals(0, scheduler.pendingCount());

        clock.advanceMillis(1);
        scheduler.runDueTasks();
        assertEquals(0, expiries.get());
    }

    @Test
    void armAfterDisarmIsIgnored() {
        deadlineClock.disarm();

        assertFalse(deadlineClock.arm(Deadline.atNanos(0), expiries::incrementAndGet));

        assertEquals(0, expiries.get());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void armingTwiceIsRejected() {
        deadlineClock.arm(Deadline.atNanos(5_000), expiries::incrementAndGet);

        assertThrows(IllegalStateException.class,
                () -> deadlineClock.arm(Deadline.atNanos(6_000), expiries::incrementAndGet));
    }
}
