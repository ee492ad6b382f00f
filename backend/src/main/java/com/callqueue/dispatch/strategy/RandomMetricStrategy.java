package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.Strategy;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

@Component("random")
public class RandomMetricStrategy implements MetricStrategy {

    @Override
    public Set<Strategy> handles() {
        return Set.of(Strategy.RANDOM);
    }

    @Override
    public long metric(MetricContext ctx) {
        return ThreadLocalRandom.current().nextInt(1000) + ctx.penaltyTerm();
    }
}
