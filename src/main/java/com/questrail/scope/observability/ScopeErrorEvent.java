package com.questrail.scope.observability;

import java.time.Instant;

/**
 * Record representing a failure inside the scope tree, for example a fire
 * subscriber or an {@code afterFire} action that threw.
 */
public record ScopeErrorEvent(
    Instant timestamp,
    long scopeId,
    String message,
    Throwable cause
) {
}
