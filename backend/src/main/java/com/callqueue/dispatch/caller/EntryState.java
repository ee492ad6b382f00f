package com.callqueue.dispatch.caller;

import java.util.EnumSet;
import java.util.Set;

public enum EntryState {
    JOINING,
    WAITING,
    ELIGIBLE,
    DIALING,
    BRIDGED,
    RETRYING,
    TIMED_OUT,
    LEFT_EMPTY,
    USER_EXITED,
    ABANDONED;

    private static final Set<EntryState> EXITS = EnumSet.of(TIMED_OUT, LEFT_EMPTY, USER_EXITED, ABANDONED);

    public boolean isTerminal() {
        return this == BRIDGED || EXITS.contains(this);
    }

    public boolean canMoveTo(EntryState next) {
        if (next == null || isTerminal()) return false;
        return switch (this) {
            case JOINING -> next == WAITING;
            case WAITING -> next == ELIGIBLE || EXITS.contains(next);
            case ELIGIBLE -> next == DIALING || next == WAITING || EXITS.contains(next);
            case DIALING -> next == BRIDGED || next == RETRYING || EXITS.contains(next);
            case RETRYING -> next == WAITING || next == ELIGIBLE || EXITS.contains(next);
            default -> false;
        };
    }
}
