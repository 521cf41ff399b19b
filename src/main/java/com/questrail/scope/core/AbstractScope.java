package com.questrail.scope.core;

import com.questrail.scope.api.CancelReason;
import com.questrail.scope.api.Cancellable;
import com.questrail.scope.api.Deadline;
import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeKey;
import com.questrail.scope.internal.signal.Signal;
import com.questrail.scope.internal.signal.Termination;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AbstractScope
 * =============================================================================
 * Base class of every scope node in the tree.
 *
 * <h2>Node hooks</h2>
 * Subclasses describe only what they add at their own level:
 * <ul>
 *   <li>{@link #ownSignal()}: a signal of their own (cancelling nodes)</li>
 *   <li>{@link #ownDeadline()}: a deadline of their own</li>
 *   <li>{@link #boundValue(ScopeKey)}: a binding of their own (value nodes)</li>
 *   <li>{@link #isDetached()}: whether cancellation and deadlines stop here on
 *       the way up (detached nodes)</li>
 * </ul>
 * Everything observable through {@link Scope} is computed here by walking the
 * parent chain in a loop, so chain length never costs stack depth.
 *
 * <h2>Parent linkage</h2>
 * Nodes hold a reference to their parent only. A parent never tracks its
 * children; children observe the parent's signal instead.
 */
public abstract class AbstractScope implements Scope {

    private static final AtomicLong IDS = new AtomicLong();
    private static final CompletableFuture<CancelReason> NEVER = new CompletableFuture<>();
    private static final CompletionStage<CancelReason> NEVER_STAGE = NEVER.minimalCompletionStage();

    private final long id = IDS.incrementAndGet();
    private final AbstractScope parent;
    private final ScopeEnvironment environment;

    AbstractScope(AbstractScope parent, ScopeEnvironment environment) {
        this.parent = parent;
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    AbstractScope(AbstractScope parent) {
        this(Objects.requireNonNull(parent, "parent"), parent.environment);
    }

    /**
     * Narrows a {@link Scope} to this implementation.
     *
     * @throws IllegalArgumentException for scope implementations not created
     *         by this library
     */
    static AbstractScope of(Scope scope) {
        Objects.requireNonNull(scope, "parent");
        if (!(scope instanceof AbstractScope)) {
            throw new IllegalArgumentException("unsupported scope implementation: " + scope.getClass().getName());
        }
        return (AbstractScope) scope;
    }

    Signal ownSignal() {
        return null;
    }

    Deadline ownDeadline() {
        return null;
    }

    <T> T boundValue(ScopeKey<T> key) {
        return null;
    }

    boolean isDetached() {
        return false;
    }

    /**
     * Fires this node with a termination inherited from an ancestor. Nodes
     * without a signal of their own ignore it.
     */
    void inherit(Termination inherited) {
    }

    final AbstractScope parent() {
        return parent;
    }

    /**
     * The nearest signal on the path to the root that can fire, or
     * {@code null} if the path holds only scopes that never fire.
     */
    final Signal cancellationSignal() {
        for (AbstractScope node = this; node != null && !node.isDetached(); node = node.parent) {
            Signal own = node.ownSignal();
            if (own != null) {
                return own;
            }
        }
        return null;
    }

    /**
     * The current termination as seen from this node, or {@code null} while
     * active. If an ancestor already fired, the signals in between are fired
     * top-down first, so no reader sees this node active after its ancestor is
     * observably fired.
     */
    final Termination termination() {
        List<AbstractScope> unfired = null;
        Termination found = null;
        for (AbstractScope node = this; node != null && !node.isDetached(); node = node.parent) {
            Signal own = node.ownSignal();
            if (own == null) {
                continue;
            }
            found = own.termination();
            if (found != null) {
                break;
            }
            if (unfired == null) {
                unfired = new ArrayList<>();
            }
            unfired.add(node);
        }
        if (found == null || unfired == null) {
            return found;
        }
        for (int i = unfired.size() - 1; i >= 0; i--) {
            AbstractScope node = unfired.get(i);
            node.inherit(found);
            found = node.ownSignal().termination();
        }
        return found;
    }

    /**
     * Diagnostic identifier, unique within this JVM.
     */
    public final long scopeId() {
        return id;
    }

    public final ScopeEnvironment environment() {
        return environment;
    }

    @Override
    public CompletionStage<CancelReason> done() {
        Signal signal = cancellationSignal();
        if (signal == null) {
            return NEVER_STAGE;
        }
        termination();
        return signal.whenFired();
    }

    @Override
    public Optional<CancelReason> err() {
        return Optional.ofNullable(termination()).map(Termination::reason);
    }

    @Override
    public Optional<Throwable> cause() {
        return Optional.ofNullable(termination()).flatMap(Termination::causeIfAny);
    }

    @Override
    public final Optional<Deadline> deadline() {
        Deadline earliest = null;
        for (AbstractScope node = this; node != null && !node.isDetached(); node = node.parent) {
            Deadline own = node.ownDeadline();
            if (own != null) {
                earliest = earliest == null ? own : earliest.earliest(own);
            }
        }
        return Optional.ofNullable(earliest);
    }

    @Override
    public Optional<Duration> timeRemaining() {
        return deadline().map(d -> d.timeRemaining(environment.clock()));
    }

    @Override
    public final <T> Optional<T> value(ScopeKey<T> key) {
        Objects.requireNonNull(key, "key");
        for (AbstractScope node = this; node != null; node = node.parent) {
            T bound = node.boundValue(key);
            if (bound != null) {
                return Optional.of(bound);
            }
        }
        return key.defaultValue();
    }

    @Override
    public CancelReason await() throws InterruptedException {
        Signal signal = cancellationSignal();
        if (signal == null) {
            return waitForever();
        }
        Termination current = termination();
        return current != null ? current.reason() : signal.await();
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        Signal signal = cancellationSignal();
        if (signal == null) {
            return waitForever(timeout);
        }
        return termination() != null || signal.await(timeout);
    }

    @Override
    public Cancellable onDone(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        Signal signal = cancellationSignal();
        if (signal == null) {
            return Cancellable.NOOP;
        }
        termination();
        return signal.onFire(listener);
    }

    @Override
    public String toString() {
        Termination t = termination();
        return getClass().getSimpleName() + "#" + id + (t == null ? "[active]" : "[" + t.reason() + "]");
    }

    private static CancelReason waitForever() throws InterruptedException {
        try {
            return NEVER.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    private static boolean waitForever(Duration timeout) throws InterruptedException {
        if (timeout.isNegative() || timeout.isZero()) {
            return false;
        }
        try {
            NEVER.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }
}
