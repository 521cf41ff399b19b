package com.questrail.scope.demo;

/**
 * Destination for validated credentials.
 */
@FunctionalInterface
public interface CredentialStore {
    void save(String username, String password);
}
