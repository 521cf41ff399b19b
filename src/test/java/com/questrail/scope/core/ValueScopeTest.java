package com.questrail.scope.core;

import com.questrail.scope.api.CancelReason;
import com.questrail.scope.api.CancellableScope;
import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeKey;
import com.questrail.scope.runtime.ScopeRuntime;
import com.questrail.scope.time.DeterministicScheduler;
import com.questrail.scope.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ValueScopeTest {

    private static final ScopeKey<String> USER = ScopeKey.named("user");
    private static final ScopeKey<Integer> ATTEMPT = ScopeKey.withDefault("attempt", 1);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private Scope root;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        root = ScopeRuntime.builder()
                .withClock(clock)
                .withScheduler(scheduler)
                .build()
                .background();
    }

    @Test
    void boundValueIsVisibleToDescendants() {
        Scope scope = ScopeDerivations.withValue(root, USER, "alice");
        CancellableScope child = ScopeDerivations.withCancel(scope);
        Scope grandchild = ScopeDerivations.withTimeout(child, Duration.ofSeconds(1));

        assertEquals(Optional.of("alice"), scope.value(USER));
        assertEquals(Optional.of("alice"), child.value(USER));
        assertEquals(Optional.of("alice"), grandchild.value(USER));
        assertTrue(root.value(USER).isEmpty());
    }

    @Test
    void nearestBindingShadowsOnlyWithinSubtree() {
        Scope outer = ScopeDerivations.withValue(root, USER, "alice");
        Scope inner = ScopeDerivations.withValue(outer, USER, "bob");
        Scope sibling = ScopeDerivations.withCancel(outer);

        assertEquals(Optional.of("bob"), inner.value(USER));
        assertEquals(Optional.of("alice"), outer.value(USER));
        assertEquals(Optional.of("alice"), sibling.value(USER));
    }

    @Test
    void keysMatchByIdentityNotName() {
        ScopeKey<String> other = ScopeKey.named("user");
        Scope scope = ScopeDerivations.withValue(root, USER, "alice");

        assertTrue(scope.value(other).isEmpty());
    }

    @Test
    void missingKeyFallsBackToDefault() {
        Scope scope = ScopeDerivations.withValue(root, USER, "alice");

        assertEquals(Optional.of(1), scope.value(ATTEMPT));
        assertEquals(Optional.of(3), ScopeDerivations.withValue(scope, ATTEMPT, 3).value(ATTEMPT));
    }

    @Test
    void nullBindingsAreRejected() {
        assertThrows(NullPointerException.class, () -> ScopeDerivations.withValue(root, USER, null));
        assertThrows(NullPointerException.class, () -> ScopeDerivations.withValue(root, null, "x"));
        assertThrows(NullPointerException.class, () -> root.value(null));
    }

    @Test
    void valueScopeFiresWithItsParent() {
        CancellableScope parent = ScopeDerivations.withCancel(root);
        Scope scope = ScopeDerivations.withValue(parent, USER, "alice");
        assertFalse(scope.isDone());

        parent.cancel();

        assertEquals(Optional.of(CancelReason.CANCELED), scope.err());
        assertTrue(scope.done().toCompletableFuture().isDone());
        assertEquals(Optional.of("alice"), scope.value(USER));
    }

    @Test
    void valueScopeReportsParentDeadline() {
        CancellableScope parent = ScopeDerivations.withTimeout(root, Duration.ofSeconds(2));
        Scope scope = ScopeDerivations.withValue(parent, USER, "alice");

        assertEquals(parent.deadline(), scope.deadline());
    }

    @Test
    void detachedScopeKeepsValuesButNotCancellation() {
        CancellableScope parent = ScopeDerivations.withTimeout(
                ScopeDerivations.withValue(root, USER, "alice"), Duration.ofSeconds(1));
        Scope detached = ScopeDerivations.withoutCancel(parent);
        CancellableScope detachedChild = ScopeDerivations.withCancel(detached);

        parent.cancel();

        assertTrue(detached.err().isEmpty());
        assertTrue(detached.deadline().isEmpty());
        assertFalse(detachedChild.isDone());
        assertEquals(Optional.of("alice"), detached.value(USER));
        assertEquals(Optional.of("alice"), detachedChild.value(USER));

        detachedChild.cancel();
        assertEquals(Optional.of(CancelReason.CANCELED), detachedChild.err());
    }

    @Test
    void detachedScopeIgnoresParentDeadline() {
        CancellableScope parent = ScopeDerivations.withTimeout(root, Duration.ofSeconds(1));
        Scope detached = ScopeDerivations.withoutCancel(parent);

        clock.advance(Duration.ofSeconds(2));
        scheduler.runDueTasks();

        assertEquals(Optional.of(CancelReason.DEADLINE_EXCEEDED), parent.err());
        assertFalse(detached.isDone());
        assertTrue(detached.timeRemaining().isEmpty());
    }
}
