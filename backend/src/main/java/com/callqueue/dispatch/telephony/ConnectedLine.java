package com.callqueue.dispatch.telephony;

public record ConnectedLine(String number, String name) {
}
