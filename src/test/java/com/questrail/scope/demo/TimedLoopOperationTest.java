package com.questrail.scope.demo;

import com.questrail.scope.api.CancelReason;
import com.questrail.scope.api.CancellableScope;
import com.questrail.scope.core.ScopeDerivations;
import com.questrail.scope.runtime.ScopeRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TimedLoopOperationTest {

    private ScopeRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = ScopeRuntime.builder().build();
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void timeoutStopsLoopPartWay() throws InterruptedException {
        try (CancellableScope scope = ScopeDerivations.withTimeout(runtime.background(), Duration.ofMillis(500))) {
            LoopReport report = new TimedLoopOperation(10, Duration.ofMillis(100)).run(scope);

            assertFalse(report.completed());
            assertEquals(Optional.of(CancelReason.DEADLINE_EXCEEDED), report.abandonReason());
            assertTrue(report.iterationsRun() >= 4 && report.iterationsRun() <= 6,
                    "iterations: " + report.iterationsRun());
        }
    }

    @Test
    void loopCompletesWithinTimeout() throws InterruptedException {
        try (CancellableScope scope = ScopeDerivations.withTimeout(runtime.background(), Duration.ofSeconds(10))) {
            LoopReport report = new TimedLoopOperation(3, Duration.ofMillis(5)).run(scope);

            assertTrue(report.completed());
            assertEquals(3, report.iterationsRun());
        }
    }

    @Test
    void firedScopeRunsNoIterations() throws InterruptedException {
        CancellableScope scope = ScopeDerivations.withCancel(runtime.background());
        scope.cancel();

        LoopReport report = new TimedLoopOperation(10, Duration.ofSeconds(1)).run(scope);

        assertEquals(0, report.iterationsRun());
        assertEquals(Optional.of(CancelReason.CANCELED), report.abandonReason());
    }

    @Test
    void negativeIterationCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TimedLoopOperation(-1, Duration.ofMillis(1)));
    }

    @Test
    void presetStopFlagRunsNoIterations() throws InterruptedException {
        LoopReport report = new TimedLoopOperation(10, Duration.ofSeconds(1)).runUntilStopped(new AtomicBoolean(true));

        assertEquals(0, report.iterationsRun());
        assertEquals(Optional.of(CancelReason.CANCELED), report.abandonReason());
    }

    @Test
    void loopWithoutStopRunsEveryIteration() throws InterruptedException {
        LoopReport report = new TimedLoopOperation(3, Duration.ofMillis(5)).runUntilStopped(new AtomicBoolean());

        assertTrue(report.completed());
        assertEquals(3, report.iterationsRun());
    }

    @Test
    void stopFlagSetMidRunEndsLoopAtNextStep() throws Exception {
        AtomicBoolean stop = new AtomicBoolean();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<LoopReport> report = executor.submit(
                    () -> new TimedLoopOperation(100, Duration.ofMillis(20)).runUntilStopped(stop));
            Thread.sleep(100);
            stop.set(true);

            LoopReport stopped = report.get(5, TimeUnit.SECONDS);
            assertFalse(stopped.completed());
            assertEquals(Optional.of(CancelReason.CANCELED), stopped.abandonReason());
            assertTrue(stopped.iterationsRun() > 0 && stopped.iterationsRun() < 100,
                    "iterations: " + stopped.iterationsRun());
        } finally {
            executor.shutdownNow();
        }
    }
}
