package com.questrail.scope.demo;

import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeCancelledException;
import com.questrail.scope.core.ScopedWork;
import com.questrail.scope.internal.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Single operation of fixed length that gives up when its scope's deadline
 * (or an explicit cancel) arrives first.
 */
public final class DeadlineBoundOperation {
    private static final Logger log = LoggerFactory.getLogger(DeadlineBoundOperation.class);

    private final Duration workDuration;
    private final MonotonicClock clock;

    public DeadlineBoundOperation(Duration workDuration, MonotonicClock clock) {
        this.workDuration = Objects.requireNonNull(workDuration, "workDuration");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BoundedRun run(Scope scope) throws InterruptedException {
        long start = clock.nowNanos();
        log.info("Operation starts (planned {}, deadline in {})",
                workDuration, scope.timeRemaining().map(Duration::toString).orElse("never"));
        try {
            ScopedWork.sleep(scope, workDuration);
        } catch (ScopeCancelledException e) {
            Duration elapsed = Duration.ofNanos(clock.nowNanos() - start);
            log.info("Operation cancelled after {}: {}", elapsed, e.reason());
            return new BoundedRun(elapsed, e.reason());
        }
        Duration elapsed = Duration.ofNanos(clock.nowNanos() - start);
        log.info("Operation finishes after {}", elapsed);
        return new BoundedRun(elapsed, null);
    }

    /**
     * Runs the operation with nothing able to interrupt it.
     */
    public BoundedRun runUninterrupted() throws InterruptedException {
        long start = clock.nowNanos();
        log.info("Operation starts (planned {}, no deadline)", workDuration);
        Thread.sleep(workDuration.toMillis());
        Duration elapsed = Duration.ofNanos(clock.nowNanos() - start);
        log.info("Operation finishes after {}", elapsed);
        return new BoundedRun(elapsed, null);
    }
}
