package com.callqueue.dispatch.queue;

import java.util.Set;

/**
 * Immutable configuration of one queue generation. A reload produces a new instance.
 *
 * @param timeoutSeconds      ring window per cycle; 0 means unbounded
 * @param maxLen              0 means no limit
 * @param penaltyMembersLimit rosters smaller than this ignore penalties
 * @param exitContext         context used to match caller digits for an early exit
 */
public record QueueSettings(
        String name,
        Strategy strategy,
        int timeoutSeconds,
        int retrySeconds,
        int wrapupSeconds,
        int maxLen,
        int weight,
        int penaltyMembersLimit,
        Set<EmptyCondition> joinEmpty,
        Set<EmptyCondition> leaveWhenEmpty,
        boolean autofill,
        AutopausePolicy autopause,
        int autopauseDelaySeconds,
        boolean autopauseBusy,
        boolean autopauseUnavail,
        boolean ringInUse,
        boolean timeoutRestart,
        int serviceLevelSeconds,
        String exitContext,
        String defaultRule,
        String musicClass,
        String joinAnnouncement,
        AnnouncementSettings announcements
) {
    public QueueSettings {
        joinEmpty = joinEmpty == null ? Set.of() : Set.copyOf(joinEmpty);
        leaveWhenEmpty = leaveWhenEmpty == null ? Set.of() : Set.copyOf(leaveWhenEmpty);
    }
}
