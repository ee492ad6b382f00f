package com.callqueue.dispatch.member;

/**
 * Shared status of one physical interface. Every member with the same state interface holds the same instance.
 * Counters are only touched under this object's monitor and never go below zero.
 */
public final class DeviceStatus {

    private final String deviceId;

    private DeviceState state = DeviceState.UNKNOWN;
    private int reserved;
    private int active;

    // guarded by the DeviceRegistry bin holding this instance
    int references;

    DeviceStatus(String deviceId) {
        this.deviceId = deviceId;
    }

    public String deviceId() {
        return deviceId;
    }

    public synchronized DeviceSnapshot snapshot() {
        return new DeviceSnapshot(deviceId, state, reserved, active);
    }

    public synchronized DeviceState state() {
        return state;
    }

    synchronized void setState(DeviceState state) {
        this.state = state == null ? DeviceState.UNKNOWN : state;
    }

    /**
     * Claims the device for one dial attempt. Without overlap the claim only succeeds on an idle device
     * with no other attempt or call in progress.
     */
    public synchronized boolean tryReserve(boolean allowOverlap) {
        if (!allowOverlap && (reserved > 0 || active > 0 || !state.acceptsNewCall())) {
            return false;
        }
        reserved++;
        return true;
    }

    public synchronized void releaseReservation() {
        if (reserved > 0) reserved--;
    }

    /**
     * The reserved attempt was answered and is now a call in progress.
     */
    public synchronized void answered() {
        if (reserved > 0) reserved--;
        active++;
    }

    public synchronized void completed() {
        if (active > 0) active--;
    }
}
