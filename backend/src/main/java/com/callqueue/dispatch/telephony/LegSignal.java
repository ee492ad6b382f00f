package com.callqueue.dispatch.telephony;

/**
 * Control signal raised asynchronously by a dialed leg.
 *
 * @param forwardTarget set for {@link LegSignalType#FORWARDED}
 * @param lineInfo      set for connected-line and redirecting updates
 */
public record LegSignal(CallLeg leg, LegSignalType type, String forwardTarget, ConnectedLine lineInfo) {

    public static LegSignal of(CallLeg leg, LegSignalType type) {
        return new LegSignal(leg, type, null, null);
    }

    public static LegSignal forwarded(CallLeg leg, String target) {
        return new LegSignal(leg, LegSignalType.FORWARDED, target, null);
    }

    public static LegSignal lineUpdate(CallLeg leg, LegSignalType type, ConnectedLine info) {
        return new LegSignal(leg, type, null, info);
    }
}
