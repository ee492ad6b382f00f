package com.callqueue.dispatch.caller;

import java.util.List;

/**
 * @param member interface that took the call, null unless answered
 */
public record QueueOutcome(QueueResult result, EntryState finalState, List<EntryState> path, String member) {

    public QueueOutcome {
        path = path == null ? List.of() : List.copyOf(path);
    }
}
