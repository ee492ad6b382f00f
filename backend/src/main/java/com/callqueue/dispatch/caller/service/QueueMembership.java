package com.callqueue.dispatch.caller.service;

import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.caller.QueueResult;
import com.callqueue.dispatch.event.QueueEventSink;
import com.callqueue.dispatch.member.service.MemberStatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Puts callers on and takes them off a queue's waiting list.
 */
@Component
public class QueueMembership {

    private static final Logger log = LoggerFactory.getLogger(QueueMembership.class);

    private final MemberStatusService statusService;
    private final QueueEventSink eventSink;

    public QueueMembership(MemberStatusService statusService, QueueEventSink eventSink) {
        this.statusService = statusService;
        this.eventSink = eventSink;
    }

    /**
     * @param requestedPosition 1-based, 0 for none; a requested position bypasses the length limit
     * @return null when the caller was added, otherwise why it was refused
     */
    public QueueResult join(QueueEntry entry, int requestedPosition) {
        var queue = entry.queue();
        var settings = queue.settings();
        if (!settings.joinEmpty().isEmpty()
                && !statusService.memberAvailable(queue, entry.band(), settings.joinEmpty())) {
            log.info("queue_join_refused queue={} call={} reason=joinempty", queue.name(), entry.callId());
            return QueueResult.JOINEMPTY;
        }

        var waiting = queue.waiting();
        int position;
        int count;
        synchronized (waiting) {
            if (settings.maxLen() > 0 && waiting.size() >= settings.maxLen() && requestedPosition <= 0) {
                log.info("queue_join_refused queue={} call={} reason=full maxlen={}", queue.name(), entry.callId(), settings.maxLen());
                return QueueResult.FULL;
            }
            position = waiting.insert(entry, requestedPosition);
            count = waiting.size();
        }
        entry.setOriginalPosition(position);
        if (requestedPosition > 0 && position != requestedPosition) {
            log.info("queue_position_adjusted queue={} call={} requested={} got={}", queue.name(), entry.callId(), requestedPosition, position);
        }

        var fields = new LinkedHashMap<String, Object>();
        fields.put("Queue", queue.name());
        fields.put("Uniqueid", entry.callId());
        fields.put("CallerIDNum", entry.session().callerContext().callerNumber());
        fields.put("Position", position);
        fields.put("Count", count);
        eventSink.notify("QueueCallerJoin", fields);
        return null;
    }

    /**
     * @return false when the caller had already left
     */
    public boolean leave(QueueEntry entry) {
        var queue = entry.queue();
        var position = entry.position();
        if (!queue.waiting().remove(entry)) return false;

        var fields = new LinkedHashMap<String, Object>();
        fields.put("Queue", queue.name());
        fields.put("Uniqueid", entry.callId());
        fields.put("Position", position);
        fields.put("Count", queue.waiting().size());
        eventSink.notify("QueueCallerLeave", fields);
        return true;
    }
}
