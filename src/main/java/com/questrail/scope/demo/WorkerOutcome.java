package com.questrail.scope.demo;

import com.questrail.scope.api.CancelReason;

/**
 * What one {@link KeySearchWorker} ended with.
 *
 * @param workerId worker identifier
 * @param status   how the worker ended
 * @param reason   the scope's reason when {@code status} is
 *                 {@link Status#ABANDONED}, otherwise {@code null}
 */
public record WorkerOutcome(int workerId, Status status, CancelReason reason) {

    public enum Status {
        FOUND_KEY,
        FINISHED,
        ABANDONED
    }

    static WorkerOutcome foundKey(int workerId) {
        return new WorkerOutcome(workerId, Status.FOUND_KEY, null);
    }

    static WorkerOutcome finished(int workerId) {
        return new WorkerOutcome(workerId, Status.FINISHED, null);
    }

    static WorkerOutcome abandoned(int workerId, CancelReason reason) {
        return new WorkerOutcome(workerId, Status.ABANDONED, reason);
    }
}
