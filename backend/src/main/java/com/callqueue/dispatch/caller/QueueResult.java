package com.callqueue.dispatch.caller;

/**
 * Why a caller left the queue. The name is published to the caller session as {@code QUEUESTATUS}.
 */
public enum QueueResult {
    ANSWERED(EntryState.BRIDGED),
    TIMEOUT(EntryState.TIMED_OUT),
    FULL(null),
    JOINEMPTY(null),
    LEAVEEMPTY(EntryState.LEFT_EMPTY),
    EXITWITHKEY(EntryState.USER_EXITED),
    ABANDON(EntryState.ABANDONED);

    private final EntryState finalState;

    QueueResult(EntryState finalState) {
        this.finalState = finalState;
    }

    /**
     * @return null for results that end the call before it ever waited
     */
    public EntryState finalState() {
        return finalState;
    }
}
