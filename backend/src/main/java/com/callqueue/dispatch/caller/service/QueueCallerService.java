package com.callqueue.dispatch.caller.service;

import com.callqueue.dispatch.caller.EntryState;
import com.callqueue.dispatch.caller.ExitDigitMatcher;
import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.caller.QueueOption;
import com.callqueue.dispatch.caller.QueueOutcome;
import com.callqueue.dispatch.caller.QueueRequest;
import com.callqueue.dispatch.caller.QueueResult;
import com.callqueue.dispatch.common.config.DispatchProperties;
import com.callqueue.dispatch.common.error.CallerHangupException;
import com.callqueue.dispatch.common.error.QueueNotFoundException;
import com.callqueue.dispatch.event.QueueEventSink;
import com.callqueue.dispatch.event.QueueLogEvent;
import com.callqueue.dispatch.member.service.MemberService;
import com.callqueue.dispatch.member.service.MemberStatusService;
import com.callqueue.dispatch.penalty.PenaltyRuleEvaluator;
import com.callqueue.dispatch.penalty.RuleRegistry;
import com.callqueue.dispatch.queue.CallQueue;
import com.callqueue.dispatch.queue.QueueRegistry;
import com.callqueue.dispatch.queue.service.QueueConfigurationService;
import com.callqueue.dispatch.ring.RingOrchestrator;
import com.callqueue.dispatch.session.CallerSession;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Blocking per-caller flow: join, wait for a turn, ring members, retry, and leave with a typed result.
 * Runs on the caller's own thread.
 */
@Service
public class QueueCallerService {

    private static final Logger log = LoggerFactory.getLogger(QueueCallerService.class);

    public static final String QUEUESTATUS = "QUEUESTATUS";

    private final QueueRegistry queueRegistry;
    private final RuleRegistry ruleRegistry;
    private final QueueMembership membership;
    private final TurnEvaluator turnEvaluator;
    private final AnnouncementService announcements;
    private final PenaltyRuleEvaluator ruleEvaluator;
    private final RingOrchestrator ringOrchestrator;
    private final CallConnector connector;
    private final MemberStatusService statusService;
    private final MemberService memberService;
    private final QueueConfigurationService configurationService;
    private final QueueEventSink eventSink;
    private final DispatchProperties props;
    private final Clock clock;
    private final Map<QueueResult, Counter> exits = new EnumMap<>(QueueResult.class);

    private record Exit(QueueResult result, String member) {

        static Exit of(QueueResult result) {
            return new Exit(result, null);
        }
    }

    public QueueCallerService(
            QueueRegistry queueRegistry,
            RuleRegistry ruleRegistry,
            QueueMembership membership,
            TurnEvaluator turnEvaluator,
            AnnouncementService announcements,
            PenaltyRuleEvaluator ruleEvaluator,
            RingOrchestrator ringOrchestrator,
            CallConnector connector,
            MemberStatusService statusService,
            MemberService memberService,
            QueueConfigurationService configurationService,
            QueueEventSink eventSink,
            DispatchProperties props,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.queueRegistry = queueRegistry;
        this.ruleRegistry = ruleRegistry;
        this.membership = membership;
        this.turnEvaluator = turnEvaluator;
        this.announcements = announcements;
        this.ruleEvaluator = ruleEvaluator;
        this.ringOrchestrator = ringOrchestrator;
        this.connector = connector;
        this.statusService = statusService;
        this.memberService = memberService;
        this.configurationService = configurationService;
        this.eventSink = eventSink;
        this.props = props;
        this.clock = clock;
        for (var result : QueueResult.values()) {
            exits.put(result, Counter.builder("callqueue.caller.exits")
                    .description("Callers leaving a queue, by result")
                    .tag("result", result.name())
                    .register(meterRegistry));
        }
    }

    /**
     * @throws QueueNotFoundException when no queue of that name is active
     */
    public QueueOutcome enter(CallerSession session, QueueRequest request) {
        var queue = queueRegistry.acquire(request.queueName())
                .orElseThrow(() -> new QueueNotFoundException(request.queueName()));
        try {
            return run(queue, session, request);
        } finally {
            queueRegistry.release(queue);
        }
    }

    private QueueOutcome run(CallQueue queue, CallerSession session, QueueRequest request) {
        var ruleName = request.rule() == null || request.rule().isBlank() ? queue.settings().defaultRule() : request.rule();
        var entry = new QueueEntry(queue, session, request, ruleRegistry.rulesFor(ruleName), clock.instant());

        var refused = membership.join(entry, request.position());
        if (refused != null) {
            eventSink.logEvent(queue.name(), entry.callId(), "NONE",
                    refused == QueueResult.FULL ? QueueLogEvent.FULL : QueueLogEvent.JOINEMPTY,
                    String.valueOf(request.priority()));
            setStatus(entry, refused);
            exits.get(refused).increment();
            return new QueueOutcome(refused, refused.finalState(), entry.path(), null);
        }
        entry.transition(EntryState.WAITING);
        var callerNumber = session.callerContext().callerNumber();
        eventSink.logEvent(queue.name(), entry.callId(), "NONE", QueueLogEvent.ENTERQUEUE,
                "|" + (callerNumber == null ? "" : callerNumber) + "|" + entry.originalPosition());
        log.info("caller_joined queue={} call={} position={} priority={}", queue.name(), entry.callId(), entry.position(), entry.priority());

        Exit exit;
        try {
            exit = loop(entry);
        } catch (CallerHangupException e) {
            log.debug("caller_hangup queue={} call={}", queue.name(), entry.callId());
            exit = Exit.of(QueueResult.ABANDON);
        }
        return finish(entry, exit);
    }

    private Exit loop(QueueEntry entry) {
        var queue = entry.queue();
        var settings = queue.settings();
        announcements.playJoinAnnouncement(entry);
        announcements.resumeHold(entry);

        var tries = 0;
        while (true) {
            var waited = waitOurTurn(entry);
            if (waited != null) return waited;
            entry.transition(EntryState.ELIGIBLE);

            var announce = false;
            while (true) {
                if (expired(entry)) return Exit.of(QueueResult.TIMEOUT);
                if (announce && settings.announcements().frequencySeconds() > 0
                        && announcements.sayPosition(entry) != CallerSession.NO_DIGIT) {
                    return Exit.of(QueueResult.EXITWITHKEY);
                }
                announce = true;
                if (announcements.sayPeriodic(entry) != CallerSession.NO_DIGIT) return Exit.of(QueueResult.EXITWITHKEY);
                if (expired(entry)) return Exit.of(QueueResult.TIMEOUT);
                ruleEvaluator.applyDueRules(entry, clock.instant());

                if (entry.state() == EntryState.RETRYING) entry.transition(EntryState.ELIGIBLE);
                entry.transition(EntryState.DIALING);
                tries++;
                var ring = ringOrchestrator.ringCycle(entry);
                switch (ring.exit()) {
                    case ANSWERED -> {
                        connector.connect(entry, ring.peer(), ring.ringTimeMs());
                        return new Exit(QueueResult.ANSWERED, ring.peer().member().iface());
                    }
                    case CALLER_HANGUP, CALLER_DISCONNECT -> {
                        return Exit.of(QueueResult.ABANDON);
                    }
                    case EXIT_KEY -> {
                        return Exit.of(QueueResult.EXITWITHKEY);
                    }
                    case NO_ANSWER -> entry.transition(EntryState.RETRYING);
                }

                if (leftEmpty(entry)) return Exit.of(QueueResult.LEAVEEMPTY);
                if (entry.has(QueueOption.NO_RETRY) && tries >= queue.members().size()) {
                    log.debug("caller_retry_exhausted queue={} call={} tries={}", queue.name(), entry.callId(), tries);
                    return Exit.of(QueueResult.TIMEOUT);
                }
                if (expired(entry)) return Exit.of(QueueResult.TIMEOUT);
                if (configurationService.isRealtime(queue.name())) memberService.refreshRealtimeMembers(queue.name());

                if (waitABit(entry)) return Exit.of(QueueResult.EXITWITHKEY);
                if (expired(entry)) return Exit.of(QueueResult.TIMEOUT);
                if (!turnEvaluator.isOurTurn(entry)) {
                    log.debug("caller_displaced queue={} call={} position={}", queue.name(), entry.callId(), entry.position());
                    entry.transition(EntryState.WAITING);
                    break;
                }
            }
        }
    }

    /**
     * @return null once it is the caller's turn
     */
    private Exit waitOurTurn(QueueEntry entry) {
        var settings = entry.queue().settings();
        var tick = props.effectiveRecheckIntervalMs();
        while (true) {
            if (turnEvaluator.isOurTurn(entry)) return null;
            if (expired(entry)) return Exit.of(QueueResult.TIMEOUT);
            if (leftEmpty(entry)) return Exit.of(QueueResult.LEAVEEMPTY);
            if (settings.announcements().frequencySeconds() > 0
                    && announcements.sayPosition(entry) != CallerSession.NO_DIGIT) {
                return Exit.of(QueueResult.EXITWITHKEY);
            }
            if (expired(entry)) return Exit.of(QueueResult.TIMEOUT);
            if (announcements.sayPeriodic(entry) != CallerSession.NO_DIGIT) return Exit.of(QueueResult.EXITWITHKEY);
            ruleEvaluator.applyDueRules(entry, clock.instant());
            if (expired(entry)) return Exit.of(QueueResult.TIMEOUT);

            var digit = entry.session().waitForDigit(boundedByExpiry(entry, tick));
            if (digit != CallerSession.NO_DIGIT && ExitDigitMatcher.validExit(entry, digit)) {
                return Exit.of(QueueResult.EXITWITHKEY);
            }
            if (expired(entry)) return Exit.of(QueueResult.TIMEOUT);
        }
    }

    /**
     * Retry pause between ring cycles.
     *
     * @return true when the caller pressed an exit sequence
     */
    private boolean waitABit(QueueEntry entry) {
        // never shorter than one recheck tick, so an empty ring cycle cannot spin
        var retryMs = Math.max(entry.queue().settings().retrySeconds() * 1000L, props.effectiveRecheckIntervalMs());
        var wait = boundedByExpiry(entry, retryMs);
        var digit = entry.session().waitForDigit(wait);
        return digit != CallerSession.NO_DIGIT && ExitDigitMatcher.validExit(entry, digit);
    }

    private Duration boundedByExpiry(QueueEntry entry, long millis) {
        var expiresAt = entry.expiresAt();
        if (expiresAt != null) {
            // rounded up so the wait never ends just short of the expiry
            var left = Duration.between(clock.instant(), expiresAt).toMillis() + 1;
            millis = Math.min(millis, left);
        }
        return Duration.ofMillis(Math.max(1, millis));
    }

    private boolean expired(QueueEntry entry) {
        return entry.isExpired(clock.instant());
    }

    private boolean leftEmpty(QueueEntry entry) {
        var queue = entry.queue();
        var conditions = queue.settings().leaveWhenEmpty();
        return !conditions.isEmpty() && !statusService.memberAvailable(queue, entry.band(), conditions);
    }

    private QueueOutcome finish(QueueEntry entry, Exit exit) {
        var queue = entry.queue();
        var result = exit.result();
        var waited = Math.max(0, Duration.between(entry.joinedAt(), clock.instant()).toSeconds());
        var positions = entry.position() + "|" + entry.originalPosition() + "|" + waited;

        switch (result) {
            case TIMEOUT -> {
                eventSink.logEvent(queue.name(), entry.callId(), "NONE", QueueLogEvent.EXITWITHTIMEOUT, positions);
                recordAbandoned(entry, waited);
            }
            case LEAVEEMPTY -> {
                eventSink.logEvent(queue.name(), entry.callId(), "NONE", QueueLogEvent.EXITEMPTY, positions);
                recordAbandoned(entry, waited);
            }
            case ABANDON -> {
                eventSink.logEvent(queue.name(), entry.callId(), "NONE", QueueLogEvent.ABANDON, positions);
                recordAbandoned(entry, waited);
            }
            case EXITWITHKEY -> eventSink.logEvent(queue.name(), entry.callId(), "NONE", QueueLogEvent.EXITWITHKEY,
                    entry.digits() + "|" + positions);
            default -> {
            }
        }

        var target = result.finalState();
        if (target != null && entry.state() != target && entry.state().canMoveTo(target)) {
            entry.transition(target);
        }
        if (result == QueueResult.TIMEOUT || result == QueueResult.LEAVEEMPTY || result == QueueResult.EXITWITHKEY) {
            stopHold(entry);
        }
        membership.leave(entry);
        setStatus(entry, result);
        exits.get(result).increment();
        log.info("caller_left queue={} call={} result={} waited={}", queue.name(), entry.callId(), result, waited);
        return new QueueOutcome(result, entry.state(), entry.path(), exit.member());
    }

    private void recordAbandoned(QueueEntry entry, long waitedSeconds) {
        var queue = entry.queue();
        var serviceLevel = queue.settings().serviceLevelSeconds();
        queue.statistics().recordAbandoned(serviceLevel > 0 && waitedSeconds <= serviceLevel);
        var fields = new LinkedHashMap<String, Object>();
        fields.put("Queue", queue.name());
        fields.put("Uniqueid", entry.callId());
        fields.put("Position", entry.position());
        fields.put("OriginalPosition", entry.originalPosition());
        fields.put("HoldTime", waitedSeconds);
        eventSink.notify("QueueCallerAbandon", fields);
    }

    private void stopHold(QueueEntry entry) {
        try {
            if (entry.has(QueueOption.RING_INSTEAD_OF_MOH)) {
                entry.session().stopIndications();
            } else {
                entry.session().stopMusicOnHold();
            }
        } catch (CallerHangupException e) {
            log.debug("caller_gone_on_exit call={}", entry.callId());
        }
    }

    private void setStatus(QueueEntry entry, QueueResult result) {
        try {
            entry.session().setVariable(QUEUESTATUS, result.name());
        } catch (CallerHangupException e) {
            log.debug("caller_gone_on_status call={} status={}", entry.callId(), result);
        }
    }
}
