package com.callqueue.dispatch.penalty;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Named penalty rule lists. A reload swaps the whole set at once; callers copy the list they use at join time.
 */
@Component
public class RuleRegistry {

    private final AtomicReference<Map<String, RuleList>> rules = new AtomicReference<>(Map.of());

    public void replaceAll(Map<String, RuleList> next) {
        rules.set(next == null ? Map.of() : Map.copyOf(next));
    }

    public Optional<RuleList> find(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(rules.get().get(name));
    }

    public List<PenaltyRule> rulesFor(String name) {
        return find(name).map(RuleList::rules).orElse(List.of());
    }

    public int size() {
        return rules.get().size();
    }
}
