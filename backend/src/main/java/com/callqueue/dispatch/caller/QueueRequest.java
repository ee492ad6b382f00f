package com.callqueue.dispatch.caller;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Parameters of one caller entering a queue.
 *
 * @param timeout  overall time the caller may spend in the queue; null for no limit
 * @param position requested 1-based insertion point; 0 for none
 * @param rule     penalty rule list overriding the queue's default rule
 */
public record QueueRequest(
        String queueName,
        Set<QueueOption> options,
        Duration timeout,
        int priority,
        int position,
        PenaltyBand band,
        String rule
) {
    public QueueRequest {
        if (queueName == null || queueName.isBlank()) throw new IllegalArgumentException("queue_name_required");
        options = options == null || options.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(options));
        band = band == null ? PenaltyBand.NONE : band;
        position = Math.max(0, position);
    }

    public static QueueRequest of(String queueName) {
        return new QueueRequest(queueName, Set.of(), null, 0, 0, PenaltyBand.NONE, null);
    }

    public QueueRequest withTimeout(Duration timeout) {
        return new QueueRequest(queueName, options, timeout, priority, position, band, rule);
    }

    public QueueRequest withPriority(int priority) {
        return new QueueRequest(queueName, options, timeout, priority, position, band, rule);
    }

    public QueueRequest withBand(PenaltyBand band) {
        return new QueueRequest(queueName, options, timeout, priority, position, band, rule);
    }

    public QueueRequest withOptions(Set<QueueOption> options) {
        return new QueueRequest(queueName, options, timeout, priority, position, band, rule);
    }

    public boolean has(QueueOption option) {
        return options.contains(option);
    }
}
