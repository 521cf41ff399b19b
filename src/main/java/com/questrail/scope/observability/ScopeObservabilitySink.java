package com.questrail.scope.observability;

/**
 * Receives observability events from the scope tree.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called on the firing thread and must not block.</p>
 */
public interface ScopeObservabilitySink {
    /**
     * Called once per scope, when it fires.
     * @param event the fire details
     */
    void onScopeFired(ScopeFiredEvent event);

    /**
     * Called when a callback running on behalf of a scope fails.
     * @param event the error event
     */
    void onError(ScopeErrorEvent event);
}
