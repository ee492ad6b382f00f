package com.callqueue.dispatch.member;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deduplicates {@link DeviceStatus} by device id. An entry lives while at least one member references it.
 */
@Component
public class DeviceRegistry {

    private final Map<String, DeviceStatus> devices = new ConcurrentHashMap<>();

    public DeviceStatus acquire(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) throw new IllegalArgumentException("device_id_required");
        return devices.compute(deviceId, (k, existing) -> {
            var status = existing == null ? new DeviceStatus(k) : existing;
            status.references++;
            return status;
        });
    }

    public void release(DeviceStatus status) {
        if (status == null) return;
        devices.computeIfPresent(status.deviceId(), (k, existing) -> {
            if (existing != status) return existing;
            if (existing.references > 0) existing.references--;
            return existing.references == 0 ? null : existing;
        });
    }

    public Optional<DeviceStatus> find(String deviceId) {
        if (deviceId == null) return Optional.empty();
        return Optional.ofNullable(devices.get(deviceId));
    }

    /**
     * @return false when no member references the device
     */
    public boolean update(String deviceId, DeviceState state) {
        var status = find(deviceId).orElse(null);
        if (status == null) return false;
        status.setState(state);
        return true;
    }

    public int size() {
        return devices.size();
    }
}
