package com.questrail.scope.core;

import com.questrail.scope.internal.time.MonotonicClock;
import com.questrail.scope.internal.time.MonotonicScheduler;
import com.questrail.scope.internal.time.WallClock;
import com.questrail.scope.observability.NullObservabilitySink;
import com.questrail.scope.observability.ScopeObservabilitySink;

import java.util.Objects;

/**
 * Collaborators shared by every scope of one tree. A root is created with an
 * environment and all derived scopes inherit it from their parent, so
 * deadlines in one tree are always measured with the same clock and armed on
 * the same scheduler.
 */
public record ScopeEnvironment(
    MonotonicClock clock,
    WallClock wallClock,
    MonotonicScheduler scheduler,
    ScopeObservabilitySink observabilitySink
) {
    public ScopeEnvironment {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(scheduler, "scheduler");
        observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }
}
