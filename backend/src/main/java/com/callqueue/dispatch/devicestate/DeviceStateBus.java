package com.callqueue.dispatch.devicestate;

import com.callqueue.dispatch.session.Subscription;

import java.util.function.Consumer;

/**
 * Fan-out of device state changes reported by the telephony side.
 */
public interface DeviceStateBus {

    Subscription subscribe(Consumer<DeviceStateChange> listener);

    void publish(DeviceStateChange change);
}
