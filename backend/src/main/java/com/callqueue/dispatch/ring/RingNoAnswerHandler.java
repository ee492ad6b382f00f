package com.callqueue.dispatch.ring;

import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.caller.QueueOption;
import com.callqueue.dispatch.event.QueueEventSink;
import com.callqueue.dispatch.event.QueueLogEvent;
import com.callqueue.dispatch.member.Member;
import com.callqueue.dispatch.member.MemberOpResult;
import com.callqueue.dispatch.member.service.MemberService;
import com.callqueue.dispatch.queue.AutopausePolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Records a member that did not pick up and applies the queue's auto-pause policy.
 */
@Component
public class RingNoAnswerHandler {

    private static final Logger log = LoggerFactory.getLogger(RingNoAnswerHandler.class);

    static final String AUTOPAUSE_REASON = "Auto-Pause";

    private final MemberService memberService;
    private final QueueEventSink eventSink;
    private final Clock clock;
    private final Counter autopaused;

    public RingNoAnswerHandler(MemberService memberService, QueueEventSink eventSink, Clock clock, MeterRegistry meterRegistry) {
        this.memberService = memberService;
        this.eventSink = eventSink;
        this.clock = clock;
        this.autopaused = Counter.builder("callqueue.ring.autopaused")
                .description("Members paused after not answering")
                .register(meterRegistry);
    }

    /**
     * @param ringTimeMs       how long the member rang
     * @param autopauseAllowed false for outcomes the queue does not pause on, e.g. busy without autopausebusy
     */
    public void ringNoAnswer(QueueEntry entry, Member member, long ringTimeMs, boolean autopauseAllowed) {
        var queue = entry.queue();
        var session = entry.session();
        log.debug("ring_no_answer queue={} call={} member={} ms={}", queue.name(), entry.callId(), member.iface(), ringTimeMs);

        if (entry.has(QueueOption.RING_WHEN_RINGING)) {
            session.stopIndications();
            session.startMusicOnHold(queue.settings().musicClass());
        }

        var fields = memberService.memberFields(queue, member);
        fields.put("Uniqueid", entry.callId());
        fields.put("RingTime", ringTimeMs);
        eventSink.notify("AgentRingNoAnswer", fields);
        eventSink.logEvent(queue.name(), entry.callId(), member.memberName(), QueueLogEvent.RINGNOANSWER, String.valueOf(ringTimeMs));

        var policy = queue.settings().autopause();
        if (policy == AutopausePolicy.OFF || !autopauseAllowed) return;

        var delay = queue.settings().autopauseDelaySeconds();
        var lastCall = member.lastCall();
        if (delay > 0 && lastCall != null && Duration.between(lastCall, clock.instant()).toSeconds() < delay) {
            log.debug("autopause_skipped_recent_call queue={} member={}", queue.name(), member.iface());
            return;
        }

        var target = policy == AutopausePolicy.ON ? queue.name() : null;
        var result = memberService.setPaused(target, member.iface(), true, AUTOPAUSE_REASON);
        if (result == MemberOpResult.OK) {
            autopaused.increment();
            log.info("member_autopaused queue={} member={} scope={}", queue.name(), member.iface(), target == null ? "all" : "queue");
        } else {
            log.warn("member_autopause_failed queue={} member={} result={}", queue.name(), member.iface(), result);
        }
    }
}
