package com.questrail.scope.runtime.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ScopeRuntimeConfig
 * -----------------------------------------------------------------------------
 * Operational configuration of a {@code ScopeRuntime}'s timer threads.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>timerBackend</b>: which timer implementation arms deadlines.</li>
 *   <li><b>timerThreads</b>: core pool size of the scheduled executor. Only
 *       used by {@link TimerBackend#SCHEDULED_EXECUTOR}.</li>
 *   <li><b>wheelTickDuration</b>: granularity of the hashed wheel. Deadlines
 *       fire up to one tick late. Only used by {@link TimerBackend#HASHED_WHEEL}.</li>
 *   <li><b>wheelTicksPerWheel</b>: number of wheel slots. Only used by
 *       {@link TimerBackend#HASHED_WHEEL}.</li>
 *   <li><b>threadNamePrefix</b>: prefix for the daemon timer thread names.</li>
 *   <li><b>shutdownTimeout</b>: how long {@code close()} waits for timer
 *       threads before forcing them down.</li>
 * </ul>
 */
public record ScopeRuntimeConfig(
        TimerBackend timerBackend,
        int timerThreads,
        Duration wheelTickDuration,
        int wheelTicksPerWheel,
        String threadNamePrefix,
        Duration shutdownTimeout
) {
    public ScopeRuntimeConfig {
        Objects.requireNonNull(timerBackend, "timerBackend");
        Objects.requireNonNull(wheelTickDuration, "wheelTickDuration");
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        if (timerThreads < 1) {
            throw new IllegalArgumentException("timerThreads must be >= 1");
        }
        if (wheelTickDuration.isNegative() || wheelTickDuration.isZero()) {
            throw new IllegalArgumentException("wheelTickDuration must be positive");
        }
        if (wheelTicksPerWheel < 1) {
            throw new IllegalArgumentException("wheelTicksPerWheel must be >= 1");
        }
        if (threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix must not be blank");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>timerBackend: SCHEDULED_EXECUTOR</li>
     *   <li>timerThreads: 1</li>
     *   <li>wheelTickDuration: 10ms</li>
     *   <li>wheelTicksPerWheel: 512</li>
     *   <li>threadNamePrefix: "scope-timer"</li>
     *   <li>shutdownTimeout: 5s</li>
     * </ul>
     */
    public static ScopeRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TimerBackend timerBackend = TimerBackend.SCHEDULED_EXECUTOR;
        private int timerThreads = 1;
        private Duration wheelTickDuration = Duration.ofMillis(10);
        private int wheelTicksPerWheel = 512;
        private String threadNamePrefix = "scope-timer";
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public Builder withTimerBackend(TimerBackend timerBackend) {
            this.timerBackend = timerBackend;
            return this;
        }

        public Builder withTimerThreads(int timerThreads) {
            this.timerThreads = timerThreads;
            return this;
        }

        public Builder withWheelTickDuration(Duration wheelTickDuration) {
            this.wheelTickDuration = wheelTickDuration;
            return this;
        }

        public Builder withWheelTicksPerWheel(int wheelTicksPerWheel) {
            this.wheelTicksPerWheel = wheelTicksPerWheel;
            return this;
        }

        public Builder withThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        public Builder withShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ScopeRuntimeConfig build() {
            return new ScopeRuntimeConfig(timerBackend, timerThreads, wheelTickDuration,
                    wheelTicksPerWheel, threadNamePrefix, shutdownTimeout);
        }
    }
}
