package com.callqueue.dispatch.telephony;

import com.callqueue.dispatch.common.error.TelephonyException;

import java.util.function.Consumer;

/**
 * Transport that creates, places, bridges and tears down call legs.
 */
public interface TelephonyChannelService {

    /**
     * Requests a leg towards {@code target}. Signals for the leg are delivered to {@code signals}
     * from transport threads until the leg is hung up.
     */
    CallLeg originate(String target, CallerContext callerContext, Consumer<LegSignal> signals) throws TelephonyException;

    void place(CallLeg leg) throws TelephonyException;

    /**
     * Blocks until the bridged call ends.
     */
    BridgeOutcome bridge(CallLeg callerLeg, CallLeg memberLeg, BridgeOptions options);

    void hangup(CallLeg leg);
}
