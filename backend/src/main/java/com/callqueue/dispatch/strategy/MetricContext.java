package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.member.Member;
import com.callqueue.dispatch.queue.CallQueue;

import java.time.Instant;

/**
 * @param index      position of the member in this ring cycle's candidate list
 * @param penalty    member penalty after the caller's raise is applied; 0 when penalties are disregarded
 * @param usePenalty false when the roster is smaller than the queue's penalty-members limit
 */
public record MetricContext(
        CallQueue queue,
        QueueEntry entry,
        Member member,
        int index,
        int penalty,
        boolean usePenalty,
        Instant now
) {

    public long penaltyTerm() {
        return usePenalty ? penalty * 1_000_000L : 0L;
    }
}
