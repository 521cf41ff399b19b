package com.questrail.scope.demo;

import com.questrail.scope.api.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validate-then-save workflow that reads the request's credentials from its
 * scope instead of taking them as parameters.
 */
public final class CredentialWorkflow {
    private static final Logger log = LoggerFactory.getLogger(CredentialWorkflow.class);

    private final CredentialStore store;

    public CredentialWorkflow(CredentialStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public void process(Scope scope) {
        log.info("Start processing");
        validate(scope);
        save(scope);
        log.info("Finish");
    }

    void validate(Scope scope) {
        scope.throwIfDone();
        String username = RequestCredentials.require(scope, RequestCredentials.USERNAME);
        String password = RequestCredentials.require(scope, RequestCredentials.PASSWORD);
        requireNotBlank(username, password);
        log.info("Username {} is valid", username);
    }

    void save(Scope scope) {
        scope.throwIfDone();
        String username = RequestCredentials.require(scope, RequestCredentials.USERNAME);
        String password = RequestCredentials.require(scope, RequestCredentials.PASSWORD);
        store.save(username, password);
        log.info("Username {} is saved", username);
    }

    /**
     * Same workflow with the credentials passed down explicitly through every
     * step.
     */
    public void process(String username, String password) {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        log.info("Start processing without scope");
        requireNotBlank(username, password);
        log.info("Username {} is valid", username);
        store.save(username, password);
        log.info("Username {} is saved", username);
        log.info("Finish");
    }

    private static void requireNotBlank(String username, String password) {
        if (username.isBlank() || password.isBlank()) {
            throw new IllegalArgumentException("credentials must not be blank");
        }
    }
}
