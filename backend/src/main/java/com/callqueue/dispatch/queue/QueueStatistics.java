package com.callqueue.dispatch.queue;

import com.callqueue.dispatch.member.MemberRoster;

/**
 * State of a queue that outlives configuration reloads: waiting callers, members, counters and the
 * round-robin cursor. Exactly one instance exists per queue name while any generation references it.
 */
public final class QueueStatistics {

    private final String name;
    private final WaitingList waiting = new WaitingList();
    private final MemberRoster members = new MemberRoster();
    private final RoundRobinCursor cursor = new RoundRobinCursor();

    private int holdTime;
    private int talkTime;
    private int completed;
    private int abandoned;
    private int completedInServiceLevel;
    private int abandonedInServiceLevel;

    // guarded by the QueueRegistry bin holding this instance
    int generations;

    QueueStatistics(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public WaitingList waiting() {
        return waiting;
    }

    public MemberRoster members() {
        return members;
    }

    public RoundRobinCursor cursor() {
        return cursor;
    }

    public synchronized void recordHoldTime(int seconds) {
        holdTime = (holdTime * 3 + Math.max(0, seconds)) / 4;
    }

    public synchronized void recordCompleted(int talkSeconds, boolean inServiceLevel) {
        completed++;
        if (inServiceLevel) completedInServiceLevel++;
        var sample = Math.max(0, talkSeconds);
        talkTime = completed == 1 ? sample : (talkTime * 3 + sample) / 4;
    }

    public synchronized void recordAbandoned(boolean inServiceLevel) {
        abandoned++;
        if (inServiceLevel) abandonedInServiceLevel++;
    }

    public synchronized int holdTime() {
        return holdTime;
    }

    public synchronized StatisticsSnapshot snapshot() {
        return new StatisticsSnapshot(waiting.size(), holdTime, talkTime, completed, abandoned,
                completedInServiceLevel, abandonedInServiceLevel);
    }
}
