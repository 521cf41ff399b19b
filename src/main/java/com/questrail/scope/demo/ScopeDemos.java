package com.questrail.scope.demo;

import com.questrail.scope.Scopes;
import com.questrail.scope.api.CancellableScope;
import com.questrail.scope.api.Scope;
import com.questrail.scope.internal.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command-line entry point running one demonstration:
 * {@code timeout}, {@code cancel}, {@code deadline} or {@code value} (default).
 * Each has a {@code without-} counterpart doing the same work with no scope.
 */
public final class ScopeDemos {
    private static final Logger log = LoggerFactory.getLogger(ScopeDemos.class);

    private ScopeDemos() {
    }

    public static void main(String[] args) throws Exception {
        String which = args.length > 0 ? args[0].toLowerCase(Locale.ROOT) : "value";
        Scope root = Scopes.background();
        switch (which) {
            case "timeout":
                timeout(root);
                break;
            case "cancel":
                cancel(root);
                break;
            case "deadline":
                deadline(root);
                break;
            case "value":
                value(root);
                break;
            case "without-timeout":
                withoutTimeout();
                break;
            case "without-cancel":
                withoutCancel();
                break;
            case "without-deadline":
                withoutDeadline();
                break;
            case "without-value":
                withoutValue();
                break;
            default:
                throw new IllegalArgumentException("unknown demo: " + which
                        + " (expected timeout, cancel, deadline, value or their without- forms)");
        }
    }

    static LoopReport timeout(Scope root) throws InterruptedException {
        log.info("Long running operation (10 seconds) cancelled by a 5 second timeout");
        try (CancellableScope scope = Scopes.withTimeout(root, Duration.ofSeconds(5))) {
            return new TimedLoopOperation(10, Duration.ofSeconds(1)).run(scope);
        }
    }

    static KeySearch.Result cancel(Scope root) throws InterruptedException, ExecutionException {
        log.info("Key search with cancel");
        Random random = new Random();
        List<KeySearchWorker> workers = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            workers.add(KeySearchWorker.random(i, random, Duration.ofSeconds(1)));
        }
        ExecutorService executor = Executors.newFixedThreadPool(workers.size());
        try {
            return new KeySearch(executor).search(root, workers);
        } finally {
            executor.shutdownNow();
        }
    }

    static BoundedRun deadline(Scope root) throws InterruptedException {
        log.info("Operation designed to run for 5 seconds, interrupted by a deadline in 3 seconds");
        try (CancellableScope scope = Scopes.withDeadline(root, Instant.now().plusSeconds(3))) {
            return new DeadlineBoundOperation(Duration.ofSeconds(5), SystemMonotonicClock.INSTANCE).run(scope);
        }
    }

    static void value(Scope root) {
        Scope request = RequestCredentials.bind(root, "boy123", "password456");
        new CredentialWorkflow((username, password) -> log.info("Stored credentials for {}", username))
                .process(request);
    }

    static LoopReport withoutTimeout() throws InterruptedException, ExecutionException {
        log.info("Long running operation (10 seconds) stopped by hand after 5 seconds");
        TimedLoopOperation operation = new TimedLoopOperation(10, Duration.ofSeconds(1));
        AtomicBoolean stop = new AtomicBoolean();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<LoopReport> report = executor.submit(() -> operation.runUntilStopped(stop));
            Thread.sleep(Duration.ofSeconds(5).toMillis());
            stop.set(true);
            return report.get();
        } finally {
            executor.shutdownNow();
        }
    }

    static KeySearch.Result withoutCancel() throws InterruptedException, ExecutionException {
        log.info("Key search without cancel");
        Random random = new Random();
        List<KeySearchWorker> workers = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            workers.add(KeySearchWorker.random(i, random, Duration.ofSeconds(1)));
        }
        ExecutorService executor = Executors.newFixedThreadPool(workers.size());
        try {
            return new KeySearch(executor).searchToCompletion(workers);
        } finally {
            executor.shutdownNow();
        }
    }

    static BoundedRun withoutDeadline() throws InterruptedException {
        log.info("Operation designed to run for 5 seconds with no deadline");
        return new DeadlineBoundOperation(Duration.ofSeconds(5), SystemMonotonicClock.INSTANCE).runUninterrupted();
    }

    static void withoutValue() {
        new CredentialWorkflow((username, password) -> log.info("Stored credentials for {}", username))
                .process("boy123", "password456");
    }
}
