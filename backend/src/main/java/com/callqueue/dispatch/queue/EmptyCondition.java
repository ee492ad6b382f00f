package com.callqueue.dispatch.queue;

/**
 * Member conditions that count as "unavailable" for the join-empty and leave-when-empty checks.
 */
public enum EmptyCondition {
    PENALTY,
    PAUSED,
    INUSE,
    RINGING,
    UNAVAILABLE,
    INVALID,
    UNKNOWN,
    WRAPUP
}
