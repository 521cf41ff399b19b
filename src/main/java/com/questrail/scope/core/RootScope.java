package com.questrail.scope.core;

import java.util.Objects;

/**
 * Root of a scope tree. Never fires, has no deadline and binds no values.
 *
 * <p>{@code background} and {@code todo} roots are both instances of this
 * class and behave identically; the name only documents intent.</p>
 */
public final class RootScope extends AbstractScope {

    private final String name;

    RootScope(ScopeEnvironment environment, String name) {
        super(null, environment);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "RootScope[" + name + "]";
    }
}
