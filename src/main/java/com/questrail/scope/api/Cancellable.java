package com.questrail.scope.api;

/**
 * Cancellable
 * =============================================================================
 * Minimal release handle shared by scheduled timer tasks, signal subscriptions
 * and {@code afterFire} registrations.
 *
 * <p>
 * This interface is intentionally tiny so it can be implemented by:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a JVM {@code ScheduledExecutorService}-backed scheduler</li>
 *   <li>a Netty hashed wheel timer</li>
 *   <li>a listener registration on a {@code Signal}</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * A handle for work that can no longer be cancelled.
     */
    Cancellable NOOP = () -> false;

    /**
     * Attempt to cancel the scheduled task or registration.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
