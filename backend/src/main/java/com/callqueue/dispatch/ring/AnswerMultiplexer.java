package com.callqueue.dispatch.ring;

import com.callqueue.dispatch.caller.ExitDigitMatcher;
import com.callqueue.dispatch.caller.QueueOption;
import com.callqueue.dispatch.queue.Strategy;
import com.callqueue.dispatch.session.CallerSignal;
import com.callqueue.dispatch.telephony.LegSignalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Single wait over the caller and every leg of a ring cycle. Returns on the first answer, when nobody is
 * left ringing, at the deadline, or when the caller leaves.
 */
@Component
public class AnswerMultiplexer {

    private static final Logger log = LoggerFactory.getLogger(AnswerMultiplexer.class);

    static final long MIN_REDIAL_WINDOW_MS = 500;

    private final RingNoAnswerHandler noAnswerHandler;
    private final Clock clock;

    public AnswerMultiplexer(RingNoAnswerHandler noAnswerHandler, Clock clock) {
        this.noAnswerHandler = noAnswerHandler;
        this.clock = clock;
    }

    public RingResult waitForAnswer(RingCycle cycle, CycleDialer dialer) {
        var entry = cycle.entry();
        var settings = entry.queue().settings();
        var ringAll = settings.strategy() == Strategy.RINGALL;
        var window = cycle.windowMs();
        var windowStart = clock.millis();

        while (true) {
            if (!cycle.anyDialing()) {
                log.debug("ring_cycle_exhausted queue={} call={} busies={}", entry.queue().name(), entry.callId(), cycle.busies());
                return RingResult.of(RingResult.Exit.NO_ANSWER);
            }

            var remaining = window < 0 ? -1 : window - (clock.millis() - windowStart);
            if (window >= 0 && remaining <= 0) {
                for (var attempt : cycle.attempts()) {
                    if (attempt.isDialing()) {
                        noAnswerHandler.ringNoAnswer(entry, attempt.member(), window, true);
                    }
                }
                return RingResult.of(RingResult.Exit.NO_ANSWER);
            }

            DialEvent event;
            try {
                event = cycle.poll(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("ring_wait_interrupted queue={} call={}", entry.queue().name(), entry.callId(), e);
                return RingResult.of(RingResult.Exit.CALLER_HANGUP);
            }
            if (event == null) continue;

            if (event.fromCaller()) {
                var exit = onCallerSignal(cycle, event.callerSignal());
                if (exit != null) return exit;
                continue;
            }
            if (event.isStale()) continue;

            var attempt = event.attempt();
            var signal = event.legSignal();
            var session = entry.session();
            switch (signal.type()) {
                case ANSWER -> {
                    if (ringAll && attempt.pendingConnectedLine() != null) {
                        session.updateConnectedLine(attempt.pendingConnectedLine());
                    }
                    log.debug("member_answered queue={} call={} member={}", entry.queue().name(), entry.callId(), attempt.member().iface());
                    return RingResult.answered(attempt, ringTimeMs(attempt));
                }
                case BUSY, CONGESTION, HANGUP -> {
                    var ringTime = ringTimeMs(attempt);
                    dialer.hangupAttempt(attempt);
                    var autopause = switch (signal.type()) {
                        case BUSY -> settings.autopauseBusy();
                        case CONGESTION -> settings.autopauseUnavail();
                        default -> true;
                    };
                    if (signal.type() != LegSignalType.HANGUP) cycle.countBusy();
                    noAnswerHandler.ringNoAnswer(entry, attempt.member(), ringTime, autopause);
                    if (!ringAll) {
                        if (settings.timeoutRestart()) windowStart = clock.millis();
                        var left = window < 0 ? Long.MAX_VALUE : window - (clock.millis() - windowStart);
                        if (left > MIN_REDIAL_WINDOW_MS) dialer.ringOne(cycle);
                    }
                }
                case RINGING -> {
                    if (entry.has(QueueOption.RING_WHEN_RINGING) && !cycle.ringingIndicated()) {
                        session.stopMusicOnHold();
                        session.indicateRinging();
                        cycle.setRingingIndicated(true);
                    }
                }
                case FORWARDED -> dialer.forward(cycle, attempt, signal.forwardTarget());
                case CONNECTED_LINE -> {
                    if (signal.lineInfo() == null) break;
                    if (ringAll) {
                        attempt.setPendingConnectedLine(signal.lineInfo());
                    } else {
                        session.updateConnectedLine(signal.lineInfo());
                    }
                }
                case REDIRECTING -> {
                    if (!ringAll && signal.lineInfo() != null) session.updateRedirecting(signal.lineInfo());
                }
            }
        }
    }

    private RingResult onCallerSignal(RingCycle cycle, CallerSignal signal) {
        var entry = cycle.entry();
        if (signal.type() == CallerSignal.Type.HANGUP) {
            log.debug("caller_hangup_while_ringing queue={} call={}", entry.queue().name(), entry.callId());
            return RingResult.of(RingResult.Exit.CALLER_HANGUP);
        }
        var digit = signal.digit();
        if (digit == '*' && entry.has(QueueOption.CALLER_DISCONNECT)) {
            return RingResult.of(RingResult.Exit.CALLER_DISCONNECT);
        }
        if (ExitDigitMatcher.validExit(entry, digit)) {
            return RingResult.exitKey(digit);
        }
        return null;
    }

    private long ringTimeMs(CallAttempt attempt) {
        if (attempt.dialedAt() == null) return 0;
        return Math.max(0, Duration.between(attempt.dialedAt(), clock.instant()).toMillis());
    }
}
