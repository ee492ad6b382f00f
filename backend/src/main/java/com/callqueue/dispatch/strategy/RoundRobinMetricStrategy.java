package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.Strategy;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Queue-wide rotation. Memory mode ranks by the cycle's candidate index, ordered mode by the member's
 * fixed place in the roster.
 */
@Component("round_robin")
public class RoundRobinMetricStrategy implements MetricStrategy {

    @Override
    public Set<Strategy> handles() {
        return Set.of(Strategy.RRMEMORY, Strategy.RRORDERED);
    }

    @Override
    public long metric(MetricContext ctx) {
        var position = ctx.queue().settings().strategy() == Strategy.RRORDERED
                ? ctx.member().position()
                : ctx.index();
        return CursorRanking.rank(ctx.queue().statistics().cursor(), position) + ctx.penaltyTerm();
    }
}
