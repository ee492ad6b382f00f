package com.callqueue.dispatch.caller.service;

import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.member.service.MemberStatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TurnEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TurnEvaluator.class);

    private final MemberStatusService statusService;

    public TurnEvaluator(MemberStatusService statusService) {
        this.statusService = statusService;
    }

    /**
     * A caller may ring members when fewer callers ahead of it are still waiting than there are members
     * available to it. Members outside the caller's penalty band do not count. Without autofill only the
     * head of the line may ring.
     */
    public boolean isOurTurn(QueueEntry entry) {
        var queue = entry.queue();
        var available = statusService.numAvailableMembers(queue, entry.band());
        var ahead = queue.waiting().countWaitingAhead(entry);
        var ours = ahead >= 0 && ahead < available && (queue.settings().autofill() || entry.position() == 1);
        log.debug("turn_check queue={} call={} ahead={} available={} ours={}", queue.name(), entry.callId(), ahead, available, ours);
        return ours;
    }
}
