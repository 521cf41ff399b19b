package com.questrail.scope.demo;

import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeCancelledException;
import com.questrail.scope.core.ScopedWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * Simulated search worker: works for a fixed time, then reports whether it
 * holds the key. The work is raced against the scope, so a worker whose scope
 * fires stops early instead of running to completion.
 */
public final class KeySearchWorker {
    private static final Logger log = LoggerFactory.getLogger(KeySearchWorker.class);

    private final int id;
    private final Duration workDuration;
    private final boolean holdsKey;

    public KeySearchWorker(int id, Duration workDuration, boolean holdsKey) {
        this.id = id;
        this.workDuration = Objects.requireNonNull(workDuration, "workDuration");
        this.holdsKey = holdsKey;
    }

    /**
     * Worker with a random key number in [1, 5] and a random work time of 1 to
     * 5 {@code unit}s. It holds the key when the drawn number equals its id.
     */
    public static KeySearchWorker random(int id, Random random, Duration unit) {
        int keyNumber = random.nextInt(5) + 1;
        Duration work = unit.multipliedBy(random.nextInt(5) + 1);
        return new KeySearchWorker(id, work, keyNumber == id);
    }

    public int id() {
        return id;
    }

    /**
     * Runs the worker. If it holds the key, it completes {@code found} with its
     * id once its work is done.
     */
    public WorkerOutcome run(Scope scope, CompletableFuture<Integer> found) throws InterruptedException {
        log.info("Worker {} start", id);
        try {
            ScopedWork.sleep(scope, workDuration);
        } catch (ScopeCancelledException e) {
            log.info("Worker {} cancelled: {}", id, e.reason());
            return WorkerOutcome.abandoned(id, e.reason());
        }

        return reportWork(found);
    }

    /**
     * Runs the worker without a scope: it works for its full time whatever
     * the other workers have found meanwhile.
     */
    public WorkerOutcome runToCompletion(CompletableFuture<Integer> found) throws InterruptedException {
        log.info("Worker {} start", id);
        Thread.sleep(workDuration.toMillis());
        return reportWork(found);
    }

    private WorkerOutcome reportWork(CompletableFuture<Integer> found) {
        if (holdsKey) {
            log.info("Worker {} found the key", id);
            found.complete(id);
            return WorkerOutcome.foundKey(id);
        }
        log.info("Worker {} finish", id);
        return WorkerOutcome.finished(id);
    }
}
