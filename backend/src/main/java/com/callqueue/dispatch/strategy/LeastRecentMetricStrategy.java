package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.Strategy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

@Component("leastrecent")
public class LeastRecentMetricStrategy implements MetricStrategy {

    private static final long HORIZON_SECONDS = 1_000_000L;

    @Override
    public Set<Strategy> handles() {
        return Set.of(Strategy.LEASTRECENT);
    }

    @Override
    public long metric(MetricContext ctx) {
        var lastCall = ctx.member().lastCall();
        long base;
        if (lastCall == null) {
            base = 0;
        } else {
            var since = Math.max(0, Duration.between(lastCall, ctx.now()).toSeconds());
            base = since < HORIZON_SECONDS ? HORIZON_SECONDS - since : 0;
        }
        return base + ctx.penaltyTerm();
    }
}
