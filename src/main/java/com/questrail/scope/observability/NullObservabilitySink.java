package com.questrail.scope.observability;

/**
 * No-op implementation of ScopeObservabilitySink.
 */
public final class NullObservabilitySink implements ScopeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onScopeFired(ScopeFiredEvent event) {}

    @Override
    public void onError(ScopeErrorEvent event) {}
}
