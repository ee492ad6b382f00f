package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.Strategy;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component("fewestcalls")
public class FewestCallsMetricStrategy implements MetricStrategy {

    @Override
    public Set<Strategy> handles() {
        return Set.of(Strategy.FEWESTCALLS);
    }

    @Override
    public long metric(MetricContext ctx) {
        return ctx.member().calls() + ctx.penaltyTerm();
    }
}
