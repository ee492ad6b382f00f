package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.common.error.MetricComputationException;
import com.callqueue.dispatch.queue.Strategy;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class MetricStrategyResolver {

    private final Map<Strategy, MetricStrategy> strategies = new EnumMap<>(Strategy.class);

    public MetricStrategyResolver(List<MetricStrategy> strategies) {
        for (var s : strategies) {
            for (var handled : s.handles()) {
                this.strategies.put(handled, s);
            }
        }
    }

    public MetricStrategy resolve(Strategy strategy) {
        var picked = strategy == null ? null : strategies.get(strategy);
        if (picked == null) throw new MetricComputationException("metric_strategy_not_found strategy=" + strategy);
        return picked;
    }
}
