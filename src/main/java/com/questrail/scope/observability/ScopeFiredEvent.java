package com.questrail.scope.observability;

import com.questrail.scope.api.CancelReason;

import java.time.Instant;

/**
 * Record describing the moment a scope fired.
 *
 * @param timestamp  wall-clock time of the fire (observational only)
 * @param scopeId    diagnostic identifier of the scope, unique per JVM
 * @param reason     terminal reason
 * @param cause      cause attached by the canceller, or {@code null}
 * @param propagated {@code true} if the fire came from an ancestor rather than
 *                   from this scope's own cancel or deadline
 */
public record ScopeFiredEvent(
    Instant timestamp,
    long scopeId,
    CancelReason reason,
    Throwable cause,
    boolean propagated
) {
}
