package com.questrail.scope.demo;

import com.questrail.scope.api.CancelReason;

import java.time.Duration;

/**
 * Outcome of a {@link DeadlineBoundOperation}.
 *
 * @param elapsed       time from start to finish or abandonment
 * @param abandonedWith reason the operation was interrupted, or {@code null}
 */
public record BoundedRun(Duration elapsed, CancelReason abandonedWith) {

    public boolean completed() {
        return abandonedWith == null;
    }
}
