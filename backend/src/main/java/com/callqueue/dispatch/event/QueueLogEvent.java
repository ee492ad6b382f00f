package com.callqueue.dispatch.event;

public enum QueueLogEvent {
    ENTERQUEUE,
    FULL,
    JOINEMPTY,
    CONNECT,
    COMPLETECALLER,
    COMPLETEAGENT,
    RINGNOANSWER,
    ABANDON,
    EXITWITHKEY,
    EXITWITHTIMEOUT,
    EXITEMPTY,
    ADDMEMBER,
    REMOVEMEMBER,
    PAUSE,
    UNPAUSE,
    PENALTY
}
