package com.callqueue.dispatch.ring;

import com.callqueue.dispatch.member.Member;
import com.callqueue.dispatch.telephony.CallLeg;
import com.callqueue.dispatch.telephony.ConnectedLine;

import java.time.Instant;

/**
 * One member candidate within one ring cycle. Only the caller's own thread touches it.
 */
public final class CallAttempt {

    private final Member member;
    private final long metric;

    private boolean stillGoing = true;
    private boolean reserved;
    private CallLeg leg;
    private Instant dialedAt;
    private ConnectedLine pendingConnectedLine;

    public CallAttempt(Member member, long metric) {
        this.member = member;
        this.metric = metric;
    }

    public Member member() {
        return member;
    }

    public long metric() {
        return metric;
    }

    public boolean stillGoing() {
        return stillGoing;
    }

    public void markDead() {
        stillGoing = false;
    }

    public boolean reserved() {
        return reserved;
    }

    void setReserved(boolean reserved) {
        this.reserved = reserved;
    }

    public CallLeg leg() {
        return leg;
    }

    void setLeg(CallLeg leg) {
        this.leg = leg;
    }

    /**
     * A leg is ringing for this attempt.
     */
    public boolean isDialing() {
        return stillGoing && leg != null;
    }

    /**
     * Not dialed yet and still allowed to be.
     */
    public boolean isPending() {
        return stillGoing && leg == null;
    }

    public Instant dialedAt() {
        return dialedAt;
    }

    void setDialedAt(Instant dialedAt) {
        this.dialedAt = dialedAt;
    }

    public ConnectedLine pendingConnectedLine() {
        return pendingConnectedLine;
    }

    void setPendingConnectedLine(ConnectedLine pendingConnectedLine) {
        this.pendingConnectedLine = pendingConnectedLine;
    }
}
