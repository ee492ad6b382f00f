package com.callqueue.dispatch.queue;

import java.util.OptionalLong;

/**
 * Rotation point for the round-robin and linear strategies. Metric computation marks it wrapped when a
 * member past the cursor is ranked; the cursor moves once per ring cycle.
 */
public final class RoundRobinCursor {

    private int position;
    private boolean wrapped;

    public synchronized int position() {
        return position;
    }

    public synchronized boolean wrapped() {
        return wrapped;
    }

    public synchronized void markWrapped() {
        wrapped = true;
    }

    /**
     * @param bestPendingMetric metric of the best attempt that was not dialed in this cycle, if any
     */
    public synchronized void advance(OptionalLong bestPendingMetric) {
        if (bestPendingMetric.isPresent()) {
            position = (int) (bestPendingMetric.getAsLong() % 1000);
        } else if (wrapped) {
            position = 0;
        } else {
            position++;
        }
        wrapped = false;
    }
}
