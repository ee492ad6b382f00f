package com.callqueue.dispatch.directory;

import com.callqueue.dispatch.member.MemberConfig;

/**
 * Stored form of one dynamic member.
 */
public record PersistedMember(
        String iface,
        String memberName,
        String stateInterface,
        int penalty,
        boolean paused,
        String pauseReason,
        int wrapupSeconds,
        Boolean ringInUse
) {

    public static PersistedMember from(MemberConfig c) {
        return new PersistedMember(c.iface(), c.memberName(), c.stateInterface(), c.penalty(), c.paused(),
                c.pauseReason(), c.wrapupSeconds(), c.ringInUse());
    }

    public MemberConfig toConfig() {
        return new MemberConfig(iface, memberName, stateInterface, penalty, paused, pauseReason, wrapupSeconds, ringInUse, null);
    }
}
