package com.callqueue.dispatch.ring;

import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.caller.QueueOption;
import com.callqueue.dispatch.common.error.MetricComputationException;
import com.callqueue.dispatch.common.error.TelephonyException;
import com.callqueue.dispatch.event.QueueEventSink;
import com.callqueue.dispatch.member.service.MemberService;
import com.callqueue.dispatch.member.service.MemberStatusService;
import com.callqueue.dispatch.penalty.QueuePreemptionService;
import com.callqueue.dispatch.queue.QueueRegistry;
import com.callqueue.dispatch.queue.Strategy;
import com.callqueue.dispatch.strategy.MetricCalculator;
import com.callqueue.dispatch.telephony.CallLeg;
import com.callqueue.dispatch.telephony.TelephonyChannelService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;

/**
 * Runs one ring cycle for an eligible caller: ranks the roster, dials the best candidate(s), waits for
 * an answer and tears down everything that did not win.
 */
@Service
public class RingOrchestrator implements CycleDialer {

    private static final Logger log = LoggerFactory.getLogger(RingOrchestrator.class);

    private final MetricCalculator metricCalculator;
    private final MemberStatusService statusService;
    private final MemberService memberService;
    private final QueuePreemptionService preemptionService;
    private final QueueRegistry queueRegistry;
    private final TelephonyChannelService telephony;
    private final AnswerMultiplexer multiplexer;
    private final QueueEventSink eventSink;
    private final Clock clock;

    private final Counter dialed;
    private final Counter skippedBusy;
    private final Counter dialFailed;
    private final Counter forwards;
    private final Timer cycleDuration;

    public RingOrchestrator(
            MetricCalculator metricCalculator,
            MemberStatusService statusService,
            MemberService memberService,
            QueuePreemptionService preemptionService,
            QueueRegistry queueRegistry,
            TelephonyChannelService telephony,
            AnswerMultiplexer multiplexer,
            QueueEventSink eventSink,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.metricCalculator = metricCalculator;
        this.statusService = statusService;
        this.memberService = memberService;
        this.preemptionService = preemptionService;
        this.queueRegistry = queueRegistry;
        this.telephony = telephony;
        this.multiplexer = multiplexer;
        this.eventSink = eventSink;
        this.clock = clock;

        this.dialed = Counter.builder("callqueue.ring.dialed")
                .description("Member legs placed")
                .register(meterRegistry);
        this.skippedBusy = Counter.builder("callqueue.ring.skipped")
                .description("Attempts skipped because the member could not be rung")
                .register(meterRegistry);
        this.dialFailed = Counter.builder("callqueue.ring.dial_failed")
                .description("Attempts the transport refused")
                .register(meterRegistry);
        this.forwards = Counter.builder("callqueue.ring.forwards")
                .description("Legs replaced after a call forward")
                .register(meterRegistry);
        this.cycleDuration = Timer.builder("callqueue.ring.cycle.duration")
                .description("Duration of one ring cycle")
                .register(meterRegistry);
    }

    public RingResult ringCycle(QueueEntry entry) {
        var startedAt = clock.instant();
        var cycle = buildCycle(entry);
        entry.clearDialedInterfaces();
        entry.setPending(true);
        var subscription = entry.session().subscribe(signal -> cycle.offer(DialEvent.caller(signal)));
        CallAttempt peer = null;
        try {
            ringOne(cycle);
            advanceCursor(cycle);
            var result = multiplexer.waitForAnswer(cycle, this);
            peer = result.peer();
            return result;
        } finally {
            subscription.close();
            entry.setPending(false);
            teardown(cycle, peer);
            cycleDuration.record(Duration.between(startedAt, clock.instant()));
        }
    }

    RingCycle buildCycle(QueueEntry entry) {
        var queue = entry.queue();
        var members = queue.members().snapshot();
        var attempts = new ArrayList<CallAttempt>(members.size());
        for (int i = 0; i < members.size(); i++) {
            var member = members.get(i);
            try {
                var metric = metricCalculator.computeMetric(queue, entry, member, i);
                if (metric.isEmpty()) {
                    log.debug("member_outside_penalty_band queue={} call={} member={}", queue.name(), entry.callId(), member.iface());
                    continue;
                }
                attempts.add(new CallAttempt(member, metric.getAsLong()));
            } catch (MetricComputationException e) {
                log.warn("metric_computation_failed queue={} member={}", queue.name(), member.iface(), e);
            }
        }
        return new RingCycle(entry, attempts, ringWindowMs(entry), clock.instant());
    }

    /**
     * Queue timeout, shortened to what is left of the caller's own limit. Negative when neither applies.
     */
    long ringWindowMs(QueueEntry entry) {
        var timeoutMs = entry.queue().settings().timeoutSeconds() * 1000L;
        var expiresAt = entry.expiresAt();
        if (expiresAt != null) {
            var left = Math.max(0, Duration.between(clock.instant(), expiresAt).toMillis());
            if (timeoutMs <= 0 || left <= timeoutMs) return left;
        }
        return timeoutMs > 0 ? timeoutMs : -1;
    }

    @Override
    public boolean ringOne(RingCycle cycle) {
        var entry = cycle.entry();
        var ringAll = entry.queue().settings().strategy() == Strategy.RINGALL;
        while (true) {
            var best = cycle.findBestPending();
            if (best == null) break;
            if (ringAll) {
                for (var attempt : cycle.attempts()) {
                    if (attempt.isPending() && attempt.metric() <= best.metric()) {
                        ringEntry(cycle, attempt);
                    }
                }
            } else {
                ringEntry(cycle, best);
            }
            if (entry.isExpired(clock.instant())) break;
            if (cycle.anyDialing()) return true;
        }
        return cycle.anyDialing();
    }

    boolean ringEntry(RingCycle cycle, CallAttempt attempt) {
        var entry = cycle.entry();
        var queue = entry.queue();
        var member = attempt.member();

        if (!statusService.canRing(queue, member)) {
            skip(cycle, attempt);
            return false;
        }
        if (queueRegistry.anyWeighted() && preemptionService.isReservedElsewhere(queue, member)) {
            log.debug("member_preempted queue={} member={}", queue.name(), member.iface());
            skip(cycle, attempt);
            return false;
        }
        if (!member.device().tryReserve(member.ringInUse())) {
            log.debug("member_device_claimed queue={} member={}", queue.name(), member.iface());
            skip(cycle, attempt);
            return false;
        }
        attempt.setReserved(true);
        entry.markDialed(member.iface());

        CallLeg leg = null;
        try {
            leg = telephony.originate(member.iface(), entry.session().callerContext(),
                    signal -> cycle.offer(DialEvent.leg(attempt, signal)));
            attempt.setLeg(leg);
            telephony.place(leg);
        } catch (TelephonyException | RuntimeException e) {
            log.warn("member_dial_failed queue={} call={} member={}", queue.name(), entry.callId(), member.iface(), e);
            if (leg != null) safeHangup(leg);
            attempt.markDead();
            releaseReservation(attempt);
            cycle.countBusy();
            dialFailed.increment();
            return false;
        }
        attempt.setDialedAt(clock.instant());
        dialed.increment();

        var fields = memberService.memberFields(queue, member);
        fields.put("Uniqueid", entry.callId());
        fields.put("CallerIDNum", entry.session().callerContext().callerNumber());
        fields.put("DestinationChannel", leg.id());
        eventSink.notify("AgentCalled", fields);
        log.debug("member_dialed queue={} call={} member={} metric={}", queue.name(), entry.callId(), member.iface(), attempt.metric());
        return true;
    }

    @Override
    public void forward(RingCycle cycle, CallAttempt attempt, String target) {
        var entry = cycle.entry();
        var queue = entry.queue();
        if (entry.has(QueueOption.IGNORE_FORWARDS) || target == null || target.isBlank()) {
            log.info("call_forward_prevented queue={} call={} member={} target={}", queue.name(), entry.callId(), attempt.member().iface(), target);
            hangupAttempt(attempt);
            cycle.countBusy();
            return;
        }
        if (!entry.markDialed(target)) {
            log.info("call_forward_loop queue={} call={} target={}", queue.name(), entry.callId(), target);
            hangupAttempt(attempt);
            cycle.countBusy();
            return;
        }

        safeHangup(attempt.leg());
        CallLeg leg = null;
        try {
            leg = telephony.originate(target, entry.session().callerContext(),
                    signal -> cycle.offer(DialEvent.leg(attempt, signal)));
            attempt.setLeg(leg);
            telephony.place(leg);
            attempt.setDialedAt(clock.instant());
            forwards.increment();
            log.debug("call_forwarded queue={} call={} member={} target={}", queue.name(), entry.callId(), attempt.member().iface(), target);
        } catch (TelephonyException | RuntimeException e) {
            log.warn("forward_dial_failed queue={} call={} target={}", queue.name(), entry.callId(), target, e);
            if (leg != null) safeHangup(leg);
            attempt.markDead();
            releaseReservation(attempt);
            cycle.countBusy();
        }
    }

    @Override
    public void hangupAttempt(CallAttempt attempt) {
        if (attempt.isDialing()) safeHangup(attempt.leg());
        attempt.markDead();
        releaseReservation(attempt);
    }

    void advanceCursor(RingCycle cycle) {
        var entry = cycle.entry();
        var strategy = entry.queue().settings().strategy();
        if (strategy.isRoundRobin()) {
            entry.queue().statistics().cursor().advance(cycle.bestPendingMetric());
        } else if (strategy == Strategy.LINEAR) {
            entry.linearCursor().advance(cycle.bestPendingMetric());
        }
    }

    private void teardown(RingCycle cycle, CallAttempt peer) {
        for (var attempt : cycle.attempts()) {
            if (attempt == peer) continue;
            hangupAttempt(attempt);
        }
    }

    private void skip(RingCycle cycle, CallAttempt attempt) {
        attempt.markDead();
        cycle.countBusy();
        skippedBusy.increment();
    }

    private void releaseReservation(CallAttempt attempt) {
        if (!attempt.reserved()) return;
        attempt.member().device().releaseReservation();
        attempt.setReserved(false);
    }

    private void safeHangup(CallLeg leg) {
        if (leg == null) return;
        try {
            telephony.hangup(leg);
        } catch (RuntimeException e) {
            log.warn("leg_hangup_failed leg={}", leg.id(), e);
        }
    }
}
