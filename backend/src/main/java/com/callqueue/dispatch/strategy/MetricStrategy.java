package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.Strategy;

import java.util.Set;

public interface MetricStrategy {

    Set<Strategy> handles();

    /**
     * @return rank of the member for this attempt; lower is tried first
     */
    long metric(MetricContext ctx);
}
