package com.questrail.scope.internal.signal;

import com.questrail.scope.api.CancelReason;

import java.util.Objects;
import java.util.Optional;

/**
 * The value recorded by the single winning {@link Signal#fire} call.
 *
 * @param reason terminal classification, never {@code null}
 * @param cause  optional cause supplied by the canceller, may be {@code null}
 */
public record Termination(CancelReason reason, Throwable cause) {

    public Termination {
        Objects.requireNonNull(reason, "reason");
    }

    public Optional<Throwable> causeIfAny() {
        return Optional.ofNullable(cause);
    }
}
