package com.callqueue.dispatch.member;

public record DeviceSnapshot(String deviceId, DeviceState state, int reserved, int active) {
}
