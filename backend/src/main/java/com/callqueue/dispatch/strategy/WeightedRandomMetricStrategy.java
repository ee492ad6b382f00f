package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.Strategy;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Penalty widens the draw instead of dominating it, so high-penalty members still get some calls.
 */
@Component("wrandom")
public class WeightedRandomMetricStrategy implements MetricStrategy {

    @Override
    public Set<Strategy> handles() {
        return Set.of(Strategy.WRANDOM);
    }

    @Override
    public long metric(MetricContext ctx) {
        var penalty = ctx.usePenalty() ? Math.max(0, ctx.penalty()) : 0;
        var bound = (1L + penalty) * 1000L;
        return ThreadLocalRandom.current().nextLong(bound);
    }
}
