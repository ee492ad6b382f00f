package com.callqueue.dispatch.telephony;

/**
 * Transport handle of one call leg.
 */
public record CallLeg(String id, String target) {
}
