package com.callqueue.dispatch.devicestate;

import com.callqueue.dispatch.session.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

@Component
public class InProcessDeviceStateBus implements DeviceStateBus {

    private static final Logger log = LoggerFactory.getLogger(InProcessDeviceStateBus.class);

    private final List<Consumer<DeviceStateChange>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(Consumer<DeviceStateChange> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void publish(DeviceStateChange change) {
        if (change == null || change.deviceId() == null) return;
        for (var listener : listeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                log.warn("device_state_listener_failed device={}", change.deviceId(), e);
            }
        }
    }
}
