package com.callqueue.dispatch.member;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeviceRegistryTest {

    private final DeviceRegistry registry = new DeviceRegistry();

    @Test
    void device_lives_while_referenced() {
        var first = registry.acquire("PJSIP/a");
        var second = registry.acquire("PJSIP/a");
        assertSame(first, second);

        registry.release(first);
        assertTrue(registry.find("PJSIP/a").isPresent());
        registry.release(second);
        assertTrue(registry.find("PJSIP/a").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> registry.acquire(" "));
    }

    @Test
    void update_only_touches_tracked_devices() {
        registry.acquire("PJSIP/a");

        assertTrue(registry.update("PJSIP/a", DeviceState.BUSY));
        assertFalse(registry.update("PJSIP/b", DeviceState.BUSY));
        assertEquals(DeviceState.BUSY, registry.find("PJSIP/a").orElseThrow().state());
        assertTrue(registry.update("PJSIP/a", null));
        assertEquals(DeviceState.UNKNOWN, registry.find("PJSIP/a").orElseThrow().state());
    }

    @Test
    void reservation_without_overlap_needs_an_idle_device() {
        var device = registry.acquire("PJSIP/a");

        assertTrue(device.tryReserve(false));
        assertFalse(device.tryReserve(false));
        assertTrue(device.tryReserve(true));
        assertEquals(2, device.snapshot().reserved());

        device.releaseReservation();
        device.releaseReservation();
        device.releaseReservation();
        assertEquals(0, device.snapshot().reserved());

        registry.update("PJSIP/a", DeviceState.INUSE);
        assertFalse(device.tryReserve(false));
    }

    @Test
    void answer_turns_a_reservation_into_a_call() {
        var device = registry.acquire("PJSIP/a");
        device.tryReserve(false);

        device.answered();
        assertEquals(0, device.snapshot().reserved());
        assertEquals(1, device.snapshot().active());
        assertFalse(device.tryReserve(false));

        device.completed();
        device.completed();
        assertEquals(0, device.snapshot().active());
        assertTrue(device.tryReserve(false));
    }

    @Test
    void parses_bus_state_names_leniently() {
        assertEquals(DeviceState.NOT_INUSE, DeviceState.parse("not-inuse"));
        assertEquals(DeviceState.RINGINUSE, DeviceState.parse("RingInUse"));
        assertEquals(DeviceState.ONHOLD, DeviceState.parse("on hold"));
        assertEquals(DeviceState.UNKNOWN, DeviceState.parse("sideways"));
        assertEquals(DeviceState.UNKNOWN, DeviceState.parse(null));
    }
}
