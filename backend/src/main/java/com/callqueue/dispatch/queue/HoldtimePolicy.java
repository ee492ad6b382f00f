package com.callqueue.dispatch.queue;

public enum HoldtimePolicy {
    NO,
    YES,
    ONCE
}
