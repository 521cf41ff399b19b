package com.questrail.scope.demo;

import com.questrail.scope.api.CancellableScope;
import com.questrail.scope.api.Scope;
import com.questrail.scope.core.ScopeDerivations;
import com.questrail.scope.core.ScopedWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs several {@link KeySearchWorker}s concurrently under a shared
 * cancellable scope and cancels the rest as soon as one of them finds the key.
 */
public final class KeySearch {
    private static final Logger log = LoggerFactory.getLogger(KeySearch.class);

    private final Executor executor;

    public KeySearch(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Result of a search.
     *
     * @param foundBy  id of the worker that found the key, if any
     * @param outcomes one outcome per worker, in submission order
     */
    public record Result(Optional<Integer> foundBy, List<WorkerOutcome> outcomes) {
        public Result {
            outcomes = List.copyOf(outcomes);
        }
    }

    /**
     * Starts every worker, waits until one finds the key or all of them end,
     * cancels the remaining workers and collects their outcomes.
     *
     * @throws com.questrail.scope.api.ScopeCancelledException if {@code parent}
     *         fires while waiting for a result
     */
    public Result search(Scope parent, List<KeySearchWorker> workers)
            throws InterruptedException, ExecutionException
    {
        Objects.requireNonNull(workers, "workers");

        try (CancellableScope scope = ScopeDerivations.withCancel(parent)) {
            CompletableFuture<Integer> found = new CompletableFuture<>();
            List<CompletableFuture<WorkerOutcome>> runs = new ArrayList<>();
            for (KeySearchWorker worker : workers) {
                runs.add(CompletableFuture.supplyAsync(() -> runWorker(() -> worker.run(scope, found)), executor));
            }
            CompletableFuture<Void> all = CompletableFuture.allOf(runs.toArray(new CompletableFuture<?>[0]));

            ScopedWork.await(parent, CompletableFuture.anyOf(found, all));

            Optional<Integer> foundBy = Optional.ofNullable(found.getNow(null));
            if (foundBy.isPresent()) {
                log.info("Got result from worker {}, cancelling the others", foundBy.get());
            } else {
                log.info("No worker found the key");
            }
            scope.cancel();

            all.get();
            return new Result(foundBy, outcomes(runs));
        }
    }

    /**
     * Same search without a scope: the first key found is reported, but every
     * worker still runs for its full time and the search waits for all of them.
     */
    public Result searchToCompletion(List<KeySearchWorker> workers)
            throws InterruptedException, ExecutionException
    {
        Objects.requireNonNull(workers, "workers");

        CompletableFuture<Integer> found = new CompletableFuture<>();
        List<CompletableFuture<WorkerOutcome>> runs = new ArrayList<>();
        for (KeySearchWorker worker : workers) {
            runs.add(CompletableFuture.supplyAsync(() -> runWorker(() -> worker.runToCompletion(found)), executor));
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(runs.toArray(new CompletableFuture<?>[0]));

        CompletableFuture.anyOf(found, all).get();
        Optional<Integer> foundBy = Optional.ofNullable(found.getNow(null));
        if (foundBy.isPresent()) {
            log.info("Got result from worker {}, other workers still running", foundBy.get());
        }

        all.get();
        log.info("Search finishes");
        return new Result(foundBy, outcomes(runs));
    }

    private static List<WorkerOutcome> outcomes(List<CompletableFuture<WorkerOutcome>> runs)
            throws InterruptedException, ExecutionException
    {
        List<WorkerOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<WorkerOutcome> run : runs) {
            outcomes.add(run.get());
        }
        return outcomes;
    }

    private static WorkerOutcome runWorker(WorkerBody body) {
        try {
            return body.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    @FunctionalInterface
    private interface WorkerBody {
        WorkerOutcome run() throws InterruptedException;
    }
}
