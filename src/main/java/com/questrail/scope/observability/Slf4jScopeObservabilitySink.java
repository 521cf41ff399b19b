package com.questrail.scope.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of ScopeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Fires are routine and logged at DEBUG; callback failures at ERROR.</p>
 */
public final class Slf4jScopeObservabilitySink implements ScopeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jScopeObservabilitySink.class);

    @Override
    public void onScopeFired(ScopeFiredEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        if (event.propagated()) {
            log.debug("Scope {} fired from ancestor: {}", event.scopeId(), event.reason());
        } else if (event.cause() != null) {
            log.debug("Scope {} fired: {} (cause: {})", event.scopeId(), event.reason(), event.cause().toString());
        } else {
            log.debug("Scope {} fired: {}", event.scopeId(), event.reason());
        }
    }

    @Override
    public void onError(ScopeErrorEvent event) {
        log.error("Scope {} error: {}", event.scopeId(), event.message(), event.cause());
    }
}
