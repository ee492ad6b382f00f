package com.callqueue.dispatch.telephony;

public record BridgeOptions(String queueName, String memberInterface, boolean callerMayDisconnect) {
}
