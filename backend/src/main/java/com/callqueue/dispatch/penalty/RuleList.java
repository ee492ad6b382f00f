package com.callqueue.dispatch.penalty;

import java.util.Comparator;
import java.util.List;

/**
 * Named rule list ordered by time.
 */
public record RuleList(String name, List<PenaltyRule> rules) {

    public RuleList {
        rules = rules == null ? List.of() : rules.stream()
                .sorted(Comparator.comparingInt(PenaltyRule::timeSeconds))
                .toList();
    }
}
