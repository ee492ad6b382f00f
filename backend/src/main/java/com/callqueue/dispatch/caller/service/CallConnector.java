package com.callqueue.dispatch.caller.service;

import com.callqueue.dispatch.caller.EntryState;
import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.caller.QueueOption;
import com.callqueue.dispatch.common.error.CallerHangupException;
import com.callqueue.dispatch.event.QueueEventSink;
import com.callqueue.dispatch.event.QueueLogEvent;
import com.callqueue.dispatch.member.service.MemberService;
import com.callqueue.dispatch.ring.CallAttempt;
import com.callqueue.dispatch.telephony.BridgeOptions;
import com.callqueue.dispatch.telephony.TelephonyChannelService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Hands an answered caller to the member and accounts the call once the bridge ends.
 */
@Component
public class CallConnector {

    private static final Logger log = LoggerFactory.getLogger(CallConnector.class);

    private final QueueMembership membership;
    private final MemberService memberService;
    private final TelephonyChannelService telephony;
    private final QueueEventSink eventSink;
    private final Clock clock;
    private final Counter connected;

    public CallConnector(
            QueueMembership membership,
            MemberService memberService,
            TelephonyChannelService telephony,
            QueueEventSink eventSink,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.membership = membership;
        this.memberService = memberService;
        this.telephony = telephony;
        this.eventSink = eventSink;
        this.clock = clock;
        this.connected = Counter.builder("callqueue.caller.connected")
                .description("Callers bridged to a member")
                .register(meterRegistry);
    }

    /**
     * Blocks for the duration of the bridged call.
     */
    public void connect(QueueEntry entry, CallAttempt peer, long ringTimeMs) {
        var queue = entry.queue();
        var member = peer.member();
        var session = entry.session();
        var holdSeconds = (int) Math.max(0, Duration.between(entry.joinedAt(), clock.instant()).toSeconds());

        queue.statistics().recordHoldTime(holdSeconds);
        membership.leave(entry);
        entry.transition(EntryState.BRIDGED);

        member.device().answered();
        member.setInCall(true);
        connected.increment();

        var ringSeconds = ringTimeMs / 1000;
        eventSink.logEvent(queue.name(), entry.callId(), member.memberName(), QueueLogEvent.CONNECT,
                holdSeconds + "|" + peer.leg().id() + "|" + ringSeconds);
        var fields = memberService.memberFields(queue, member);
        fields.put("Uniqueid", entry.callId());
        fields.put("HoldTime", holdSeconds);
        fields.put("RingTime", ringSeconds);
        eventSink.notify("AgentConnect", fields);

        var bridgedAt = clock.instant();
        var agentHungUp = false;
        try {
            if (entry.has(QueueOption.RING_INSTEAD_OF_MOH)) {
                session.stopIndications();
            } else {
                session.stopMusicOnHold();
            }
            var outcome = telephony.bridge(session.leg(), peer.leg(),
                    new BridgeOptions(queue.name(), member.iface(), entry.has(QueueOption.CALLER_DISCONNECT)));
            agentHungUp = outcome != null && outcome.agentHungUp();
        } catch (CallerHangupException e) {
            log.debug("caller_gone_before_bridge queue={} call={}", queue.name(), entry.callId());
        } catch (RuntimeException e) {
            log.warn("bridge_failed queue={} call={} member={}", queue.name(), entry.callId(), member.iface(), e);
        } finally {
            member.device().completed();
            member.setInCall(false);
            try {
                telephony.hangup(peer.leg());
            } catch (RuntimeException e) {
                log.warn("leg_hangup_failed leg={}", peer.leg().id(), e);
            }
        }

        var talkSeconds = (int) Math.max(0, Duration.between(bridgedAt, clock.instant()).toSeconds());
        var serviceLevel = queue.settings().serviceLevelSeconds();
        memberService.recordCallCompleted(queue, member);
        queue.statistics().recordCompleted(talkSeconds, serviceLevel > 0 && holdSeconds <= serviceLevel);

        var event = agentHungUp ? QueueLogEvent.COMPLETEAGENT : QueueLogEvent.COMPLETECALLER;
        eventSink.logEvent(queue.name(), entry.callId(), member.memberName(), event,
                holdSeconds + "|" + talkSeconds + "|" + entry.originalPosition());
        var done = memberService.memberFields(queue, member);
        done.put("Uniqueid", entry.callId());
        done.put("HoldTime", holdSeconds);
        done.put("TalkTime", talkSeconds);
        done.put("Reason", agentHungUp ? "agent" : "caller");
        eventSink.notify("AgentComplete", done);
    }
}
