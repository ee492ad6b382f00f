package com.callqueue.dispatch.member;

public enum MemberOrigin {
    STATIC,
    REALTIME,
    DYNAMIC
}
