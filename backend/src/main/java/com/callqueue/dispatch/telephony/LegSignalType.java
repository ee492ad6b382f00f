package com.callqueue.dispatch.telephony;

public enum LegSignalType {
    ANSWER,
    BUSY,
    CONGESTION,
    RINGING,
    FORWARDED,
    CONNECTED_LINE,
    REDIRECTING,
    HANGUP
}
