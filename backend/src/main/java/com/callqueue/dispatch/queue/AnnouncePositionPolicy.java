package com.callqueue.dispatch.queue;

public enum AnnouncePositionPolicy {
    NO,
    YES,
    LIMIT,
    MORE
}
