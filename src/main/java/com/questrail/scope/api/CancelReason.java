package com.questrail.scope.api;

/**
 * CancelReason
 * -----------------------------------------------------------------------------
 * The terminal classification recorded when a scope fires.
 *
 * Exactly one of these values becomes the permanent reason of a fired scope.
 * No other error kinds are produced by the scope tree.
 */
public enum CancelReason
{
    /**
     * An explicit stop was requested by some party holding the cancel handle.
     */
    CANCELED("scope canceled"),

    /**
     * The scope's effective deadline elapsed before an explicit cancel.
     */
    DEADLINE_EXCEEDED("scope deadline exceeded");

    private final String message;

    CancelReason(String message) {
        this.message = message;
    }

    /**
     * Human-readable description used in exception messages and logs.
     */
    public String message() {
        return message;
    }
}
