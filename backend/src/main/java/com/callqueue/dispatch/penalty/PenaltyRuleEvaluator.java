package com.callqueue.dispatch.penalty;

import com.callqueue.dispatch.caller.PenaltyBand;
import com.callqueue.dispatch.caller.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class PenaltyRuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PenaltyRuleEvaluator.class);

    /**
     * Applies every rule that is due at {@code now}.
     *
     * @return number of rules applied
     */
    public int applyDueRules(QueueEntry entry, Instant now) {
        var applied = 0;
        while (applyNextDueRule(entry, now)) {
            applied++;
        }
        return applied;
    }

    /**
     * Applies the entry's active rule if its time has come and moves the entry past it. The check and the
     * advance happen under the entry lock, so a second call at the same elapsed time is a no-op.
     */
    public boolean applyNextDueRule(QueueEntry entry, Instant now) {
        var elapsed = Math.max(0, Duration.between(entry.joinedAt(), now).toSeconds());
        synchronized (entry) {
            var rule = entry.activeRule();
            if (rule == null || elapsed < rule.timeSeconds()) return false;
            var next = apply(entry.band(), rule);
            entry.setBand(next);
            entry.advanceRule(elapsed);
            log.debug("penalty_rule_applied call_id={} elapsed={} min={} max={} raise={}",
                    entry.callId(), elapsed, next.min(), next.max(), next.raise());
            return true;
        }
    }

    /**
     * Relative steps leave an unset bound unset. Results are clamped to zero and min never exceeds max.
     */
    public static PenaltyBand apply(PenaltyBand band, PenaltyRule rule) {
        var max = step(band.max(), rule.maxValue(), rule.maxRelative());
        var min = step(band.min(), rule.minValue(), rule.minRelative());
        var raise = step(band.raise(), rule.raiseValue(), rule.raiseRelative());
        if (min != null && max != null && min > max) {
            min = max;
        }
        return new PenaltyBand(min, max, raise);
    }

    private static Integer step(Integer current, int value, boolean relative) {
        Integer next;
        if (relative) {
            if (current == null) return null;
            next = current + value;
        } else {
            next = value;
        }
        return Math.max(0, next);
    }
}
