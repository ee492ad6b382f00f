package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.member.Member;
import com.callqueue.dispatch.queue.CallQueue;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.OptionalLong;

/**
 * Ranks one member for one caller attempt.
 */
@Component
public class MetricCalculator {

    private final MetricStrategyResolver resolver;
    private final Clock clock;

    public MetricCalculator(MetricStrategyResolver resolver, Clock clock) {
        this.resolver = resolver;
        this.clock = clock;
    }

    /**
     * @param index the member's position in this cycle's candidate list
     * @return empty when the caller's penalty band excludes the member
     */
    public OptionalLong computeMetric(CallQueue queue, QueueEntry entry, Member member, int index) {
        var settings = queue.settings();
        var usePenalty = queue.members().size() >= settings.penaltyMembersLimit();
        var band = entry.band();
        // a roster below the penalty-members limit ranks everyone at penalty 0, raise included
        var penalty = usePenalty ? band.raised(member.penalty()) : 0;
        if (usePenalty && band.excludes(penalty)) {
            return OptionalLong.empty();
        }
        var ctx = new MetricContext(queue, entry, member, index, penalty, usePenalty, clock.instant());
        return OptionalLong.of(resolver.resolve(settings.strategy()).metric(ctx));
    }
}
