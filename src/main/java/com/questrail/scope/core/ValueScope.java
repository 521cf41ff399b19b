package com.questrail.scope.core;

import com.questrail.scope.api.ScopeKey;

import java.util.Objects;

/**
 * View node that adds one typed binding in front of its parent's chain.
 *
 * <p>It owns no signal, deadline or cancel function: it fires exactly when its
 * parent does. The binding is fixed at construction.</p>
 */
final class ValueScope<V> extends AbstractScope {

    private final ScopeKey<V> key;
    private final V value;

    ValueScope(AbstractScope parent, ScopeKey<V> key, V value) {
        super(parent);
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    @SuppressWarnings("unchecked")
    <T> T boundValue(ScopeKey<T> lookup) {
        // Same key instance, hence same T.
        return lookup == key ? (T) value : null;
    }
}
