package com.callqueue.dispatch.member;

import java.time.Instant;

/**
 * A dial target in one queue's roster. The same interface in two queues is two {@code Member} objects
 * that share one {@link DeviceStatus}.
 */
public final class Member {

    private final String iface;
    private final String stateInterface;
    private final MemberOrigin origin;
    private final DeviceStatus device;

    private String memberName;
    private String uniqueId;
    private int penalty;
    private boolean paused;
    private String pauseReason;
    private Instant lastPauseAt;
    private int wrapupSeconds;
    private boolean ringInUse;

    private int calls;
    private Instant lastCall;
    private String lastQueue;
    private int lastWrapupSeconds;
    private boolean inCall;
    private int position;

    public Member(MemberConfig config, MemberOrigin origin, DeviceStatus device, boolean ringInUseDefault) {
        this.iface = config.iface();
        this.stateInterface = config.stateInterface();
        this.origin = origin;
        this.device = device;
        this.memberName = config.memberName();
        this.uniqueId = config.uniqueId();
        this.penalty = config.penalty();
        this.paused = config.paused();
        this.pauseReason = config.pauseReason();
        this.wrapupSeconds = config.wrapupSeconds();
        this.ringInUse = config.ringInUse() == null ? ringInUseDefault : config.ringInUse();
    }

    public String iface() {
        return iface;
    }

    public String stateInterface() {
        return stateInterface;
    }

    public MemberOrigin origin() {
        return origin;
    }

    public DeviceStatus device() {
        return device;
    }

    public boolean isDynamic() {
        return origin == MemberOrigin.DYNAMIC;
    }

    public synchronized String memberName() {
        return memberName;
    }

    public synchronized String uniqueId() {
        return uniqueId;
    }

    public synchronized int penalty() {
        return penalty;
    }

    public synchronized void setPenalty(int penalty) {
        this.penalty = Math.max(0, penalty);
    }

    public synchronized boolean paused() {
        return paused;
    }

    public synchronized String pauseReason() {
        return pauseReason;
    }

    public synchronized Instant lastPauseAt() {
        return lastPauseAt;
    }

    public synchronized void setPaused(boolean paused, String reason, Instant now) {
        this.paused = paused;
        this.pauseReason = paused ? reason : null;
        if (paused) this.lastPauseAt = now;
    }

    public synchronized int wrapupSeconds() {
        return wrapupSeconds;
    }

    public synchronized boolean ringInUse() {
        return ringInUse;
    }

    public synchronized void setRingInUse(boolean ringInUse) {
        this.ringInUse = ringInUse;
    }

    public synchronized int calls() {
        return calls;
    }

    public synchronized Instant lastCall() {
        return lastCall;
    }

    public synchronized String lastQueue() {
        return lastQueue;
    }

    public synchronized int lastWrapupSeconds() {
        return lastWrapupSeconds;
    }

    public synchronized void recordCall(Instant at, String queueName, int queueWrapupSeconds) {
        calls++;
        lastCall = at;
        lastQueue = queueName;
        lastWrapupSeconds = queueWrapupSeconds;
    }

    public synchronized boolean inCall() {
        return inCall;
    }

    public synchronized void setInCall(boolean inCall) {
        this.inCall = inCall;
    }

    public synchronized int position() {
        return position;
    }

    synchronized void setPosition(int position) {
        this.position = position;
    }

    /**
     * Applies a changed static or realtime definition. Call statistics are kept.
     */
    public synchronized void update(MemberConfig config, boolean ringInUseDefault) {
        this.memberName = config.memberName();
        this.uniqueId = config.uniqueId();
        this.penalty = config.penalty();
        this.wrapupSeconds = config.wrapupSeconds();
        this.ringInUse = config.ringInUse() == null ? ringInUseDefault : config.ringInUse();
        if (origin == MemberOrigin.REALTIME) {
            this.paused = config.paused();
            this.pauseReason = config.paused() ? config.pauseReason() : null;
        }
    }

    public synchronized MemberConfig toConfig() {
        return new MemberConfig(iface, memberName, stateInterface, penalty, paused, pauseReason, wrapupSeconds, ringInUse, uniqueId);
    }

    public boolean sameInterface(String other) {
        return other != null && iface.equalsIgnoreCase(other);
    }
}
