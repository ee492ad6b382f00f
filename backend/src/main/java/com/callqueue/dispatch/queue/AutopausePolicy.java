package com.callqueue.dispatch.queue;

public enum AutopausePolicy {
    OFF,
    /** pause the member in the queue that rang it */
    ON,
    /** pause the member in every queue */
    ALL
}
