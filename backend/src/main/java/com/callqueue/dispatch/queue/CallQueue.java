package com.callqueue.dispatch.queue;

import com.callqueue.dispatch.member.MemberRoster;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One configuration generation of a queue. The registry holds one reference and every waiting caller
 * holds another; the generation stays usable after a reload until the last of them is released.
 */
public final class CallQueue {

    private final QueueSettings settings;
    private final QueueStatistics statistics;
    private final long generation;
    private final AtomicBoolean dead = new AtomicBoolean(false);
    private final AtomicInteger references = new AtomicInteger(1);

    CallQueue(QueueSettings settings, QueueStatistics statistics, long generation) {
        this.settings = settings;
        this.statistics = statistics;
        this.generation = generation;
    }

    public String name() {
        return settings.name();
    }

    public QueueSettings settings() {
        return settings;
    }

    public QueueStatistics statistics() {
        return statistics;
    }

    public WaitingList waiting() {
        return statistics.waiting();
    }

    public MemberRoster members() {
        return statistics.members();
    }

    public long generation() {
        return generation;
    }

    /**
     * True once a newer generation replaced this one or the queue was removed from configuration.
     */
    public boolean isDead() {
        return dead.get();
    }

    void markDead() {
        dead.set(true);
    }

    void retain() {
        references.incrementAndGet();
    }

    int releaseReference() {
        return references.updateAndGet(n -> Math.max(0, n - 1));
    }

    int references() {
        return references.get();
    }
}
