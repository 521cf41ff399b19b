package com.questrail.scope;

import com.questrail.scope.api.Cancellable;
import com.questrail.scope.api.CancellableScope;
import com.questrail.scope.api.Deadline;
import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeKey;
import com.questrail.scope.core.ScopeDerivations;
import com.questrail.scope.runtime.ScopeRuntime;

import java.time.Duration;
import java.time.Instant;

/**
 * Scopes
 * =============================================================================
 * Entry point of the library.
 *
 * <h2>Typical use</h2>
 * <pre>{@code
 * Scope root = Scopes.background();
 * try (CancellableScope request = Scopes.withTimeout(root, Duration.ofSeconds(5))) {
 *     Scope withUser = Scopes.withValue(request, USERNAME, "boy123");
 *     handler.handle(withUser);
 * }
 * }</pre>
 *
 * <h2>Explicit passing</h2>
 * There is no "current scope". A scope is an ordinary value passed as the first
 * parameter to every function that needs it, so concurrent call graphs keep
 * disjoint trees.
 *
 * <p>Derived scopes use the runtime of their root. The roots returned here
 * belong to {@link ScopeRuntime#shared()}.</p>
 */
public final class Scopes {

    private Scopes() {
    }

    /**
     * The unique root of the shared runtime. Never fires.
     */
    public static Scope background() {
        return ScopeRuntime.shared().background();
    }

    /**
     * Placeholder root for code not yet handed a proper scope. Behaves exactly
     * like {@link #background()}.
     */
    public static Scope todo() {
        return ScopeRuntime.shared().todo();
    }

    public static CancellableScope withCancel(Scope parent) {
        return ScopeDerivations.withCancel(parent);
    }

    public static CancellableScope withTimeout(Scope parent, Duration timeout) {
        return ScopeDerivations.withTimeout(parent, timeout);
    }

    public static CancellableScope withDeadline(Scope parent, Instant at) {
        return ScopeDerivations.withDeadline(parent, at);
    }

    public static CancellableScope withDeadline(Scope parent, Deadline deadline) {
        return ScopeDerivations.withDeadline(parent, deadline);
    }

    public static <T> Scope withValue(Scope parent, ScopeKey<T> key, T value) {
        return ScopeDerivations.withValue(parent, key, value);
    }

    public static Scope withoutCancel(Scope parent) {
        return ScopeDerivations.withoutCancel(parent);
    }

    public static Cancellable afterFire(Scope scope, Runnable action) {
        return ScopeDerivations.afterFire(scope, action);
    }
}
