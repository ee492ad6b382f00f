package com.callqueue.dispatch.member;

public enum MemberOpResult {
    OK,
    EXISTS,
    NOT_FOUND,
    NOT_DYNAMIC,
    NO_SUCH_QUEUE,
    INVALID
}
