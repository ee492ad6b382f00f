package com.callqueue.dispatch.queue;

public record StatisticsSnapshot(
        int waiting,
        int holdTimeSeconds,
        int talkTimeSeconds,
        int completed,
        int abandoned,
        int completedInServiceLevel,
        int abandonedInServiceLevel
) {
}
