package com.questrail.scope.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ScopeKey
 * -----------------------------------------------------------------------------
 * Typed identity for a request-scoped value bound with {@code withValue}.
 *
 * <h2>Identity, not equality</h2>
 * Two keys are the same key only if they are the same instance, even when they
 * carry the same name. Keys are expected to be declared once as
 * {@code static final} constants by the code that owns the value. The name is
 * used only for {@link #toString()} and diagnostics.
 *
 * <h2>Typed lookup</h2>
 * The value type travels with the key, so a lookup through
 * {@link Scope#value(ScopeKey)} never needs a caller-side cast and a value of
 * the wrong type cannot be bound under a key.
 *
 * @param <T> the type of value bound under this key
 */
public final class ScopeKey<T>
{
    private final String name;
    private final T defaultValue;

    private ScopeKey(String name, T defaultValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.defaultValue = defaultValue;
    }

    /**
     * Creates a key with no default; lookups that find no binding are empty.
     */
    public static <T> ScopeKey<T> named(String name) {
        return new ScopeKey<>(name, null);
    }

    /**
     * Creates a key whose lookups fall back to {@code defaultValue} when no
     * scope in the chain binds it.
     */
    public static <T> ScopeKey<T> withDefault(String name, T defaultValue) {
        return new ScopeKey<>(name, Objects.requireNonNull(defaultValue, "defaultValue"));
    }

    public String name() {
        return name;
    }

    public Optional<T> defaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    @Override
    public String toString() {
        return "ScopeKey[" + name + "]";
    }
}
