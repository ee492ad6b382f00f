package com.callqueue.dispatch.member;

/**
 * Definition of a member as supplied by configuration, the realtime tables or a persisted roster.
 *
 * @param stateInterface device whose status the member follows; defaults to the interface
 * @param ringInUse      null means the queue's ring-in-use setting
 * @param wrapupSeconds  0 means the queue's wrap-up time
 */
public record MemberConfig(
        String iface,
        String memberName,
        String stateInterface,
        int penalty,
        boolean paused,
        String pauseReason,
        int wrapupSeconds,
        Boolean ringInUse,
        String uniqueId
) {

    public MemberConfig {
        if (iface == null || iface.isBlank()) throw new IllegalArgumentException("member_interface_required");
        iface = iface.trim();
        memberName = memberName == null || memberName.isBlank() ? iface : memberName.trim();
        stateInterface = stateInterface == null || stateInterface.isBlank() ? iface : stateInterface.trim();
        penalty = Math.max(0, penalty);
        wrapupSeconds = Math.max(0, wrapupSeconds);
    }

    public static MemberConfig of(String iface) {
        return new MemberConfig(iface, null, null, 0, false, null, 0, null, null);
    }

    public MemberConfig withPenalty(int penalty) {
        return new MemberConfig(iface, memberName, stateInterface, penalty, paused, pauseReason, wrapupSeconds, ringInUse, uniqueId);
    }
}
