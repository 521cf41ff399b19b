package com.questrail.scope.internal.signal;

import com.questrail.scope.api.CancelReason;
import com.questrail.scope.api.Cancellable;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SignalTest
 * -----------------------------------------------------------------------------
 * One-shot broadcast semantics: single winner, released waiters, subscriber
 * ordering relative to waiter release.
 */
class SignalTest {

    private final List<RuntimeException> failures = Collections.synchronizedList(new ArrayList<>());
    private final Signal signal = new Signal(failures::add);

    @Test
    void newSignalIsNotFired() {
        assertFalse(signal.isFired());
        assertTrue(signal.reason().isEmpty());
        assertNull(signal.termination());
        assertFalse(signal.whenFired().toCompletableFuture().isDone());
    }

    @Test
    void firstFireWinsAndLaterFiresAreNoOps() {
        assertTrue(signal.fire(CancelReason.DEADLINE_EXCEEDED));
        assertFalse(signal.fire(CancelReason.CANCELED));
        assertFalse(signal.fire(CancelReason.CANCELED, new IllegalStateException("late")));

        assertEquals(CancelReason.DEADLINE_EXCEEDED, signal.reason().orElseThrow());
        assertNull(signal.termination().cause());
    }

    @Test
    void causeIsRecordedWithWinningFire() {
        IllegalStateException cause = new IllegalStateException("shutdown");
        signal.fire(CancelReason.CANCELED, cause);

        assertSame(cause, signal.termination().cause());
        assertSame(cause, signal.termination().causeIfAny().orElseThrow());
    }

    @Test
    void concurrentFiresRecordExactlyOneWinner() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CyclicBarrier barrier = new CyclicBarrier(threads);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                CancelReason reason = i % 2 == 0 ? CancelReason.CANCELED : CancelReason.DEADLINE_EXCEEDED;
                results.add(pool.submit(() -> {
                    barrier.await();
                    return signal.fire(reason);
                }));
            }

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertTrue(signal.isFired());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void allWaitersAreReleasedByOneFire() throws Exception {
        int waiters = 8;
        ExecutorService pool = Executors.newFixedThreadPool(waiters);
        try {
            CountDownLatch waiting = new CountDownLatch(waiters);
            AtomicInteger released = new AtomicInteger();
            List<Future<CancelReason>> results = new ArrayList<>();
            for (int i = 0; i < waiters; i++) {
                results.add(pool.submit(() -> {
                    waiting.countDown();
                    CancelReason reason = signal.await();
                    released.incrementAndGet();
                    return reason;
                }));
            }

            assertTrue(waiting.await(1, TimeUnit.SECONDS));
            signal.fire(CancelReason.CANCELED);

            for (Future<CancelReason> result : results) {
                assertEquals(CancelReason.CANCELED, result.get(1, TimeUnit.SECONDS));
            }
            assertEquals(waiters, released.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void lateWaitReturnsImmediately() throws InterruptedException {
        signal.fire(CancelReason.CANCELED);

        long before = System.nanoTime();
        assertEquals(CancelReason.CANCELED, signal.await());
        assertTrue(signal.await(Duration.ofSeconds(10)));
        assertTrue(System.nanoTime() - before < TimeUnit.MILLISECONDS.toNanos(500));
    }

    @Test
    void boundedWaitTimesOutWhenNotFired() throws InterruptedException {
        assertFalse(signal.await(Duration.ofMillis(20)));
        assertFalse(signal.await(Duration.ZERO));
    }

    @Test
    void subscribersRunBeforeWaitersAreReleased() {
        List<Boolean> stageDoneDuringListener = new ArrayList<>();
        signal.onFire(() -> stageDoneDuringListener.add(signal.whenFired().toCompletableFuture().isDone()));

        signal.fire(CancelReason.CANCELED);

        assertEquals(List.of(false), stageDoneDuringListener);
        assertTrue(signal.whenFired().toCompletableFuture().isDone());
    }

    @Test
    void subscribersRunOnceInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        signal.onFire(() -> calls.add("first"));
        signal.onFire(() -> calls.add("second"));

        signal.fire(CancelReason.CANCELED);
        signal.fire(CancelReason.DEADLINE_EXCEEDED);

        assertEquals(List.of("first", "second"), calls);
        assertEquals(0, signal.listenerCount());
    }

    @Test
    void subscribingAfterFireRunsImmediately() {
        signal.fire(CancelReason.DEADLINE_EXCEEDED);
        AtomicInteger calls = new AtomicInteger();

        Cancellable handle = signal.onFire(calls::incrementAndGet);

        assertEquals(1, calls.get());
        assertFalse(handle.cancel());
    }

    @Test
    void cancelledSubscriptionDoesNotRun() {
        AtomicInteger calls = new AtomicInteger();
        Cancellable handle = signal.onFire(calls::incrementAndGet);
        assertEquals(1, signal.listenerCount());

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());
        assertEquals(0, signal.listenerCount());

        signal.fire(CancelReason.CANCELED);
        assertEquals(0, calls.get());
    }

    @Test
    void failingSubscriberIsReportedAndOthersStillRun() {
        AtomicInteger calls = new AtomicInteger();
        signal.onFire(() -> { throw new IllegalStateException("boom"); });
        signal.onFire(calls::incrementAndGet);

        assertTrue(signal.fire(CancelReason.CANCELED));

        assertEquals(1, calls.get());
        assertEquals(1, failures.size());
        assertEquals("boom", failures.get(0).getMessage());
        assertTrue(signal.whenFired().toCompletableFuture().isDone());
    }

    @Test
    void erroringSubscriberStillReleasesWaiters() {
        AtomicInteger ran = new AtomicInteger();
        signal.onFire(() -> {
            throw new SubscriberError();
        });
        signal.onFire(ran::incrementAndGet);

        assertThrows(SubscriberError.class, () -> signal.fire(CancelReason.CANCELED));

        assertTrue(signal.isFired());
        assertEquals(1, ran.get());
        assertTrue(signal.whenFired().toCompletableFuture().isDone());
        assertTrue(failures.isEmpty());
    }

    @Test
    void longChainOfSubscribedSignalsFiresWithoutDeepStack() {
        List<Signal> chain = new ArrayList<>();
        for (int i = 0; i < 50_000; i++) {
            chain.add(new Signal(failures::add));
        }
        for (int i = 0; i < chain.size() - 1; i++) {
            Signal next = chain.get(i + 1);
            chain.get(i).onFire(() -> next.fire(CancelReason.DEADLINE_EXCEEDED));
        }
        Signal last = chain.get(chain.size() - 1);
        List<Boolean> lastFiredFirst = new ArrayList<>();
        chain.get(0).whenFired().thenRun(() -> lastFiredFirst.add(last.isFired()));

        assertTrue(chain.get(0).fire(CancelReason.DEADLINE_EXCEEDED));

        for (Signal s : chain) {
            assertTrue(s.whenFired().toCompletableFuture().isDone());
        }
        assertEquals(List.of(true), lastFiredFirst);
    }

    @Test
    void fireFromSubscriberRecordsImmediatelyAndCompletesAfterOuterFire() {
        Signal other = new Signal(failures::add);
        List<Boolean> seenInside = new ArrayList<>();
        signal.onFire(() -> {
            assertTrue(other.fire(CancelReason.CANCELED));
            seenInside.add(other.isFired());
            seenInside.add(other.whenFired().toCompletableFuture().isDone());
        });

        signal.fire(CancelReason.CANCELED);

        assertEquals(List.of(true, false), seenInside);
        assertTrue(other.whenFired().toCompletableFuture().isDone());
    }

    private static final class SubscriberError extends Error {
        SubscriberError() {
            super("subscriber failed hard");
        }
    }
}
