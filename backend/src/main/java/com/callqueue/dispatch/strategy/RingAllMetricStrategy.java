package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.Strategy;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component("ringall")
public class RingAllMetricStrategy implements MetricStrategy {

    @Override
    public Set<Strategy> handles() {
        return Set.of(Strategy.RINGALL);
    }

    @Override
    public long metric(MetricContext ctx) {
        return ctx.penaltyTerm();
    }
}
