package com.questrail.scope.runtime.config;

/**
 * Timer implementation used to arm scope deadlines.
 */
public enum TimerBackend
{
    /**
     * JDK {@code ScheduledThreadPoolExecutor}: precise, O(log n) arm/disarm.
     */
    SCHEDULED_EXECUTOR,

    /**
     * Netty {@code HashedWheelTimer}: tick-granular, O(1) arm/disarm.
     */
    HASHED_WHEEL
}
