package com.questrail.scope.runtime;

import com.questrail.scope.api.Scope;
import com.questrail.scope.core.ScopeDerivations;
import com.questrail.scope.core.ScopeEnvironment;
import com.questrail.scope.internal.time.HashedWheelTimerScheduler;
import com.questrail.scope.internal.time.MonotonicClock;
import com.questrail.scope.internal.time.MonotonicScheduler;
import com.questrail.scope.internal.time.ScheduledExecutorScheduler;
import com.questrail.scope.internal.time.SystemMonotonicClock;
import com.questrail.scope.internal.time.SystemWallClock;
import com.questrail.scope.internal.time.WallClock;
import com.questrail.scope.observability.NullObservabilitySink;
import com.questrail.scope.observability.ScopeObservabilitySink;
import com.questrail.scope.observability.Slf4jScopeObservabilitySink;
import com.questrail.scope.runtime.config.ScopeRuntimeConfig;
import io.netty.util.HashedWheelTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ScopeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one family of scope trees: it owns
 * the timer threads and hands out the {@code background} and {@code todo}
 * roots from which every other scope is derived.
 *
 * <h2>Shared runtime</h2>
 * {@link #shared()} is the process-wide runtime behind {@code Scopes}. Its
 * timer threads are daemons and it is never closed.
 *
 * <h2>Dedicated runtimes</h2>
 * {@link #builder()} creates an isolated runtime, typically to inject a manual
 * clock and a deterministic scheduler in tests, or to pick a different timer
 * backend. Closing it stops the timers it created; timers supplied through
 * {@link Builder#withScheduler(MonotonicScheduler)} remain the caller's.
 */
public final class ScopeRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScopeRuntime.class);

    private final ScopeEnvironment environment;
    private final Scope background;
    private final Scope todo;
    private final Runnable shutdown;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ScopeRuntime(ScopeEnvironment environment, Runnable shutdown) {
        this.environment = environment;
        this.background = ScopeDerivations.root(environment, "background");
        this.todo = ScopeDerivations.root(environment, "todo");
        this.shutdown = shutdown;
    }

    /**
     * The process-wide runtime.
     */
    public static ScopeRuntime shared() {
        return SharedHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Root scope for top-level operations. Never fires.
     */
    public Scope background() {
        return background;
    }

    /**
     * Root scope marking a call site where the right scope has not been
     * threaded through yet. Behaves exactly like {@link #background()}.
     */
    public Scope todo() {
        return todo;
    }

    public ScopeEnvironment environment() {
        return environment;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops the timer threads this runtime created. Deadlines that have not
     * fired yet will not fire afterwards. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            shutdown.run();
        }
    }

    private static final class SharedHolder {
        private static final ScopeRuntime INSTANCE = ScopeRuntime.builder()
                .withObservabilitySink(new Slf4jScopeObservabilitySink())
                .build();
    }

    public static final class Builder {
        private ScopeRuntimeConfig config = ScopeRuntimeConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ScopeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(ScopeRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Uses an externally owned scheduler instead of creating timer threads.
         * The scheduler must measure deadlines with the same clock.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withObservabilitySink(ScopeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public ScopeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            if (scheduler != null) {
                return new ScopeRuntime(
                        new ScopeEnvironment(clock, wallClock, scheduler, observabilitySink),
                        () -> { });
            }

            ThreadFactory threadFactory = daemonThreadFactory(config.threadNamePrefix());

            switch (config.timerBackend()) {
                case HASHED_WHEEL: {
                    HashedWheelTimer timer = new HashedWheelTimer(
                            threadFactory,
                            config.wheelTickDuration().toNanos(),
                            TimeUnit.NANOSECONDS,
                            config.wheelTicksPerWheel());
                    MonotonicScheduler wheel = new HashedWheelTimerScheduler(timer, clock);
                    return new ScopeRuntime(
                            new ScopeEnvironment(clock, wallClock, wheel, observabilitySink),
                            () -> {
                                int pending = timer.stop().size();
                                log.debug("Stopped scope timer wheel; {} pending deadlines dropped", pending);
                            });
                }
                case SCHEDULED_EXECUTOR:
                default: {
                    ScheduledThreadPoolExecutor executor =
                            new ScheduledThreadPoolExecutor(config.timerThreads(), threadFactory);
                    executor.setRemoveOnCancelPolicy(true);
                    MonotonicScheduler scheduled = new ScheduledExecutorScheduler(executor, clock);
                    return new ScopeRuntime(
                            new ScopeEnvironment(clock, wallClock, scheduled, observabilitySink),
                            () -> shutdownExecutor(executor, config));
                }
            }
        }

        private static void shutdownExecutor(ScheduledThreadPoolExecutor executor, ScopeRuntimeConfig config) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(config.shutdownTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                    log.warn("Scope timer threads did not terminate within {}", config.shutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private static ThreadFactory daemonThreadFactory(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return task -> {
                Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
