package com.questrail.scope.demo;

import com.questrail.scope.api.Scope;
import com.questrail.scope.api.ScopeKey;
import com.questrail.scope.core.ScopeDerivations;

/**
 * Typed keys for the credentials of one request, plus helpers to bind and
 * read them.
 */
public final class RequestCredentials {

    public static final ScopeKey<String> USERNAME = ScopeKey.named("username");
    public static final ScopeKey<String> PASSWORD = ScopeKey.named("password");

    private RequestCredentials() {
    }

    public static Scope bind(Scope parent, String username, String password) {
        Scope withUser = ScopeDerivations.withValue(parent, USERNAME, username);
        return ScopeDerivations.withValue(withUser, PASSWORD, password);
    }

    /**
     * @throws IllegalStateException if no scope in the chain binds {@code key}
     */
    public static String require(Scope scope, ScopeKey<String> key) {
        return scope.value(key)
                .orElseThrow(() -> new IllegalStateException("missing request value: " + key.name()));
    }
}
