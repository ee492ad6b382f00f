package com.callqueue.dispatch.penalty;

import com.callqueue.dispatch.common.error.InvalidQueueConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.TreeMap;

/**
 * Parses penalty change lines of the form {@code time,max[,min[,raise]]}. A value prefixed with
 * {@code +} or {@code -}, or left empty, is relative to the caller's current bound.
 */
public final class PenaltyRuleParser {

    private static final Logger log = LoggerFactory.getLogger(PenaltyRuleParser.class);

    private PenaltyRuleParser() {
    }

    public static PenaltyRule parseLine(String line) {
        if (line == null || line.isBlank()) throw new InvalidQueueConfigException("penalty_rule_empty");
        var parts = line.split(",", -1);
        if (parts.length < 2) throw new InvalidQueueConfigException("penalty_rule_missing_max");

        int time;
        try {
            time = Integer.parseInt(parts[0].trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueueConfigException("penalty_rule_time_invalid");
        }
        if (time < 0) throw new InvalidQueueConfigException("penalty_rule_time_invalid");

        var max = value(parts[1]);
        var min = parts.length > 2 ? value(parts[2]) : Value.UNCHANGED;
        var raise = parts.length > 3 ? value(parts[3]) : Value.UNCHANGED;
        return new PenaltyRule(time, max.amount(), max.relative(), min.amount(), min.relative(), raise.amount(), raise.relative());
    }

    /**
     * Malformed lines are logged and skipped. A later line with the same time replaces the earlier one.
     */
    public static RuleList parse(String name, List<String> lines) {
        var byTime = new TreeMap<Integer, PenaltyRule>();
        if (lines != null) {
            for (var line : lines) {
                try {
                    var rule = parseLine(line);
                    var previous = byTime.put(rule.timeSeconds(), rule);
                    if (previous != null) {
                        log.warn("penalty_rule_replaced rule={} time={}", name, rule.timeSeconds());
                    }
                } catch (InvalidQueueConfigException e) {
                    log.warn("penalty_rule_rejected rule={} line={} reason={}", name, line, e.getMessage());
                }
            }
        }
        return new RuleList(name, List.copyOf(byTime.values()));
    }

    private record Value(int amount, boolean relative) {
        static final Value UNCHANGED = new Value(0, true);
    }

    private static Value value(String raw) {
        var s = raw == null ? "" : raw.trim();
        if (s.isEmpty()) return Value.UNCHANGED;
        var relative = s.charAt(0) == '+' || s.charAt(0) == '-';
        try {
            return new Value(Integer.parseInt(s), relative);
        } catch (NumberFormatException e) {
            throw new InvalidQueueConfigException("penalty_rule_value_invalid");
        }
    }
}
