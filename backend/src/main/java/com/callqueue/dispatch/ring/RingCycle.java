package com.callqueue.dispatch.ring;

import com.callqueue.dispatch.caller.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * State of one pass over the roster for one caller: the ranked attempts and the event queue every
 * dialed leg and the caller feed into.
 */
public final class RingCycle {

    private static final Logger log = LoggerFactory.getLogger(RingCycle.class);

    static final int EVENT_CAPACITY = 256;

    private final QueueEntry entry;
    private final List<CallAttempt> attempts;
    private final long windowMs;
    private final Instant startedAt;
    private final BlockingQueue<DialEvent> events = new LinkedBlockingQueue<>(EVENT_CAPACITY);

    private int busies;
    private boolean ringingIndicated;

    /**
     * @param windowMs ring window of this cycle; negative for no limit
     */
    public RingCycle(QueueEntry entry, List<CallAttempt> attempts, long windowMs, Instant startedAt) {
        this.entry = entry;
        this.attempts = List.copyOf(attempts);
        this.windowMs = windowMs;
        this.startedAt = startedAt;
    }

    public QueueEntry entry() {
        return entry;
    }

    public List<CallAttempt> attempts() {
        return attempts;
    }

    public long windowMs() {
        return windowMs;
    }

    public boolean unbounded() {
        return windowMs < 0;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public int busies() {
        return busies;
    }

    void countBusy() {
        busies++;
    }

    boolean ringingIndicated() {
        return ringingIndicated;
    }

    void setRingingIndicated(boolean ringingIndicated) {
        this.ringingIndicated = ringingIndicated;
    }

    /**
     * Best attempt that has not been dialed yet, ties going to the earlier candidate.
     */
    public CallAttempt findBestPending() {
        CallAttempt best = null;
        for (var a : attempts) {
            if (!a.isPending()) continue;
            if (best == null || a.metric() < best.metric()) best = a;
        }
        return best;
    }

    public OptionalLong bestPendingMetric() {
        var best = findBestPending();
        return best == null ? OptionalLong.empty() : OptionalLong.of(best.metric());
    }

    public boolean anyDialing() {
        for (var a : attempts) {
            if (a.isDialing()) return true;
        }
        return false;
    }

    void offer(DialEvent event) {
        if (!events.offer(event)) {
            log.warn("dial_event_dropped call={} queue={}", entry.callId(), entry.queue().name());
        }
    }

    DialEvent poll(long timeoutMs) throws InterruptedException {
        if (timeoutMs < 0) return events.take();
        return events.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
