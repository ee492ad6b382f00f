package com.callqueue.dispatch.telephony;

import com.callqueue.dispatch.common.error.TelephonyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Used when no transport is wired in. Every dial attempt fails and is counted busy.
 */
public class UnavailableTelephonyChannelService implements TelephonyChannelService {

    private static final Logger log = LoggerFactory.getLogger(UnavailableTelephonyChannelService.class);

    @Override
    public CallLeg originate(String target, CallerContext callerContext, Consumer<LegSignal> signals) throws TelephonyException {
        log.warn("telephony_not_configured target={}", target);
        throw new TelephonyException("telephony_not_configured");
    }

    @Override
    public void place(CallLeg leg) throws TelephonyException {
        throw new TelephonyException("telephony_not_configured");
    }

    @Override
    public BridgeOutcome bridge(CallLeg callerLeg, CallLeg memberLeg, BridgeOptions options) {
        throw new IllegalStateException("telephony_not_configured");
    }

    @Override
    public void hangup(CallLeg leg) {
        // nothing was ever dialed
    }
}
