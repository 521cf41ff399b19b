package com.questrail.scope.core;

/**
 * Keeps the parent's value bindings but none of its cancellation: never fires
 * and has no deadline. Scopes derived from it start a fresh cancellation
 * chain.
 */
final class DetachedScope extends AbstractScope {

    DetachedScope(AbstractScope parent) {
        super(parent);
    }

    @Override
    boolean isDetached() {
        return true;
    }
}
