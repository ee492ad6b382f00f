package com.callqueue.dispatch.penalty;

import com.callqueue.dispatch.member.Member;
import com.callqueue.dispatch.member.service.MemberStatusService;
import com.callqueue.dispatch.queue.CallQueue;
import com.callqueue.dispatch.queue.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-queue weighting: a member shared with a heavier queue that has callers waiting and not enough
 * free members is left to that queue.
 */
@Service
public class QueuePreemptionService {

    private static final Logger log = LoggerFactory.getLogger(QueuePreemptionService.class);

    private final QueueRegistry queueRegistry;
    private final MemberStatusService statusService;

    public QueuePreemptionService(QueueRegistry queueRegistry, MemberStatusService statusService) {
        this.queueRegistry = queueRegistry;
        this.statusService = statusService;
    }

    public boolean isReservedElsewhere(CallQueue queue, Member member) {
        var weight = queue.settings().weight();
        for (var other : queueRegistry.activeQueues()) {
            if (other == queue || other.name().equals(queue.name())) continue;
            if (other.settings().weight() <= weight) continue;
            var waiting = other.waiting().size();
            if (waiting == 0) continue;
            if (!other.members().contains(member.iface())) continue;
            if (waiting >= statusService.numAvailableMembers(other)) {
                log.debug("member_reserved_elsewhere queue={} member={} by={} weight={}",
                        queue.name(), member.iface(), other.name(), other.settings().weight());
                return true;
            }
        }
        return false;
    }
}
