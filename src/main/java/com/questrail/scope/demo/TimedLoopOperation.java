package com.questrail.scope.demo;

import com.questrail.scope.api.CancelReason;
import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeCancelledException;
import com.questrail.scope.core.ScopedWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-running loop that checks its scope at the top of every iteration and
 * races each step's wait against it.
 */
public final class TimedLoopOperation {
    private static final Logger log = LoggerFactory.getLogger(TimedLoopOperation.class);

    private final int iterations;
    private final Duration step;

    public TimedLoopOperation(int iterations, Duration step) {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0");
        }
        this.iterations = iterations;
        this.step = Objects.requireNonNull(step, "step");
    }

    public LoopReport run(Scope scope) throws InterruptedException {
        Objects.requireNonNull(scope, "scope");
        int started = 0;
        try {
            for (int i = 0; i < iterations; i++) {
                scope.throwIfDone();
                started++;
                log.info("Operation {} running", i);
                ScopedWork.sleep(scope, step);
            }
        } catch (ScopeCancelledException e) {
            log.info("Operation abandoned after {} iterations: {}", started, e.reason());
            return new LoopReport(started, e.reason());
        }
        log.info("Simulation complete");
        return new LoopReport(started, null);
    }

    /**
     * Same loop stopped by a caller-owned flag instead of a scope. The flag is
     * only seen between steps, so a stop request waits out the current step.
     */
    public LoopReport runUntilStopped(AtomicBoolean stopRequested) throws InterruptedException {
        Objects.requireNonNull(stopRequested, "stopRequested");
        int started = 0;
        for (int i = 0; i < iterations; i++) {
            if (stopRequested.get()) {
                log.info("Operation {} cancelled", i);
                return new LoopReport(started, CancelReason.CANCELED);
            }
            started++;
            log.info("Operation {} running", i);
            Thread.sleep(step.toMillis());
        }
        log.info("Simulation complete");
        return new LoopReport(started, null);
    }
}
