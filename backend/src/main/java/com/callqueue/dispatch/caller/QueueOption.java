package com.callqueue.dispatch.caller;

public enum QueueOption {
    /** ringback instead of hold music while waiting */
    RING_INSTEAD_OF_MOH,
    /** ringback only while a member is actually ringing */
    RING_WHEN_RINGING,
    /** leave after one full cycle over the roster */
    NO_RETRY,
    IGNORE_FORWARDS,
    /** '*' while members are dialed disconnects the caller */
    CALLER_DISCONNECT
}
