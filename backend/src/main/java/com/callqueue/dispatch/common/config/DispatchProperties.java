package com.callqueue.dispatch.common.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Global dispatch options shared by every queue.
 *
 * @param sharedLastCall       completing a call updates the member entry in every queue with the same interface
 * @param persistentMembers    dynamic members are written back to the directory after each roster change
 * @param realtimeEnabled      queues and members are also read from the realtime tables
 * @param recheckIntervalMs    tick of the waiting loop; 0 means the default of one second
 * @param deviceStateQueueCapacity pending device-state updates before the publisher is refused
 */
@Validated
@ConfigurationProperties(prefix = "app.dispatch")
public record DispatchProperties(
        boolean sharedLastCall,
        boolean persistentMembers,
        boolean realtimeEnabled,
        @PositiveOrZero long recheckIntervalMs,
        @PositiveOrZero int deviceStateQueueCapacity
) {

    public long effectiveRecheckIntervalMs() {
        return recheckIntervalMs <= 0 ? 1000 : Math.max(10, Math.min(recheckIntervalMs, 60_000));
    }

    public int effectiveDeviceStateQueueCapacity() {
        return deviceStateQueueCapacity <= 0 ? 10_000 : deviceStateQueueCapacity;
    }
}
