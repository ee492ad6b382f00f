package com.callqueue.dispatch.devicestate;

import com.callqueue.dispatch.member.DeviceState;

public record DeviceStateChange(String deviceId, DeviceState state) {
}
