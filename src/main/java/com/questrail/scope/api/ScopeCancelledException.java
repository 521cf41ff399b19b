package com.questrail.scope.api;

import java.util.Objects;

/**
 * Raised by a worker (or a helper acting on its behalf) that abandoned its
 * work because the scope it was given fired first.
 *
 * The {@link CancelReason} is always present so callers can distinguish an
 * explicit cancel from an elapsed deadline.
 */
public final class ScopeCancelledException extends RuntimeException
{
    private final CancelReason reason;

    public ScopeCancelledException(CancelReason reason) {
        this(reason, null);
    }

    public ScopeCancelledException(CancelReason reason, Throwable cause) {
        super(Objects.requireNonNull(reason, "reason").message(), cause);
        this.reason = reason;
    }

    public CancelReason reason() {
        return reason;
    }

    public boolean isDeadlineExceeded() {
        return reason == CancelReason.DEADLINE_EXCEEDED;
    }
}
