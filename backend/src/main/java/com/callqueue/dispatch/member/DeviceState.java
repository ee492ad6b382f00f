package com.callqueue.dispatch.member;

import java.util.Locale;

public enum DeviceState {
    UNKNOWN,
    NOT_INUSE,
    INUSE,
    BUSY,
    INVALID,
    UNAVAILABLE,
    RINGING,
    RINGINUSE,
    ONHOLD;

    /**
     * Lenient parse of a status name as published on the device-state bus.
     */
    public static DeviceState parse(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        var key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (key) {
            case "NOT_INUSE", "NOTINUSE", "IDLE" -> NOT_INUSE;
            case "INUSE", "IN_USE" -> INUSE;
            case "BUSY" -> BUSY;
            case "INVALID" -> INVALID;
            case "UNAVAILABLE" -> UNAVAILABLE;
            case "RINGING" -> RINGING;
            case "RINGINUSE", "RING_INUSE" -> RINGINUSE;
            case "ONHOLD", "ON_HOLD", "HOLD" -> ONHOLD;
            default -> UNKNOWN;
        };
    }

    /**
     * States in which a member that refuses overlapping calls may still be rung.
     */
    public boolean acceptsNewCall() {
        return this == NOT_INUSE || this == UNKNOWN;
    }

    public boolean isOccupied() {
        return this == INUSE || this == RINGING || this == RINGINUSE || this == ONHOLD;
    }
}
