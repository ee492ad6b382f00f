package com.callqueue.dispatch.queue;

import com.callqueue.dispatch.common.error.QueueNotFoundException;
import com.callqueue.dispatch.member.DeviceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Active queue generations and their shared statistics, both keyed by queue name.
 * Lookup-or-create and reference counting happen inside the map's per-key lock; callers then work on the
 * returned object without holding it.
 */
@Component
public class QueueRegistry {

    private static final Logger log = LoggerFactory.getLogger(QueueRegistry.class);

    private final Map<String, CallQueue> queues = new ConcurrentHashMap<>();
    private final Map<String, QueueStatistics> statistics = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    private final DeviceRegistry deviceRegistry;

    public QueueRegistry(DeviceRegistry deviceRegistry) {
        this.deviceRegistry = deviceRegistry;
    }

    /**
     * Installs a new generation for {@code settings.name()}. Waiting callers, members and counters carry over.
     */
    public CallQueue activate(QueueSettings settings) {
        if (settings == null || settings.name() == null || settings.name().isBlank()) {
            throw new IllegalArgumentException("queue_name_required");
        }
        var name = settings.name();
        var stats = statistics.compute(name, (k, existing) -> {
            var s = existing == null ? new QueueStatistics(k) : existing;
            s.generations++;
            return s;
        });
        var queue = new CallQueue(settings, stats, generations.incrementAndGet());
        var previous = queues.put(name, queue);
        if (previous != null) {
            previous.markDead();
            release(previous);
        }
        log.debug("queue_activated queue={} generation={}", name, queue.generation());
        return queue;
    }

    /**
     * Unlinks a queue that disappeared from configuration. Its statistics live on until the last
     * caller holding the generation leaves.
     */
    public boolean deactivate(String name) {
        if (name == null) return false;
        var removed = queues.remove(name);
        if (removed == null) return false;
        removed.markDead();
        release(removed);
        log.info("queue_deactivated queue={}", name);
        return true;
    }

    public Optional<CallQueue> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(queues.get(name));
    }

    public CallQueue require(String name) {
        return find(name).orElseThrow(() -> new QueueNotFoundException(name));
    }

    /**
     * Finds the current generation and takes a reference on it. Pair with {@link #release(CallQueue)}.
     */
    public Optional<CallQueue> acquire(String name) {
        if (name == null) return Optional.empty();
        var holder = new CallQueue[1];
        queues.computeIfPresent(name, (k, q) -> {
            q.retain();
            holder[0] = q;
            return q;
        });
        return Optional.ofNullable(holder[0]);
    }

    public void release(CallQueue queue) {
        if (queue == null) return;
        if (queue.releaseReference() > 0) return;

        var stats = queue.statistics();
        var unlinked = new boolean[1];
        statistics.computeIfPresent(stats.name(), (k, existing) -> {
            if (existing != stats) return existing;
            if (existing.generations > 0) existing.generations--;
            if (existing.generations > 0) return existing;
            unlinked[0] = true;
            return null;
        });
        if (unlinked[0]) {
            for (var member : stats.members().snapshot()) {
                deviceRegistry.release(member.device());
            }
            log.debug("queue_statistics_unlinked queue={}", stats.name());
        }
    }

    public Optional<QueueStatistics> findStatistics(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(statistics.get(name));
    }

    public List<CallQueue> activeQueues() {
        var list = new ArrayList<>(queues.values());
        list.sort(Comparator.comparing(CallQueue::name));
        return list;
    }

    public List<String> names() {
        return activeQueues().stream().map(CallQueue::name).toList();
    }

    /**
     * Cross-queue weight checks are only needed once some queue carries a weight.
     */
    public boolean anyWeighted() {
        for (var q : queues.values()) {
            if (q.settings().weight() > 0) return true;
        }
        return false;
    }
}
