package com.callqueue.dispatch.telephony;

/**
 * @param agentHungUp true when the member side ended the bridged call
 */
public record BridgeOutcome(boolean agentHungUp) {
}
