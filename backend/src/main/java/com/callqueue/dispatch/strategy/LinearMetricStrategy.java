package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.Strategy;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Hunts the roster in order, resuming per caller where its previous cycle stopped.
 */
@Component("linear")
public class LinearMetricStrategy implements MetricStrategy {

    @Override
    public Set<Strategy> handles() {
        return Set.of(Strategy.LINEAR);
    }

    @Override
    public long metric(MetricContext ctx) {
        return CursorRanking.rank(ctx.entry().linearCursor(), ctx.index()) + ctx.penaltyTerm();
    }
}
