package com.questrail.scope.demo;

import com.questrail.scope.api.CancelReason;

import java.util.Optional;

/**
 * Outcome of a {@link TimedLoopOperation} run.
 *
 * @param iterationsRun  number of iterations that started
 * @param abandonedWith  reason the loop stopped early, or {@code null} if it
 *                       ran to completion
 */
public record LoopReport(int iterationsRun, CancelReason abandonedWith) {

    public boolean completed() {
        return abandonedWith == null;
    }

    public Optional<CancelReason> abandonReason() {
        return Optional.ofNullable(abandonedWith);
    }
}
