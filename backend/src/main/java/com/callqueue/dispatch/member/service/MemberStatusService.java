package com.callqueue.dispatch.member.service;

import com.callqueue.dispatch.caller.PenaltyBand;
import com.callqueue.dispatch.member.DeviceState;
import com.callqueue.dispatch.member.Member;
import com.callqueue.dispatch.queue.CallQueue;
import com.callqueue.dispatch.queue.EmptyCondition;
import com.callqueue.dispatch.queue.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Availability decisions over members and their shared device status.
 */
@Service
public class MemberStatusService {

    private static final Logger log = LoggerFactory.getLogger(MemberStatusService.class);

    private final Clock clock;

    public MemberStatusService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Raw device status corrected by the attempts and calls this core itself has on the device,
     * which the transport may not have reported yet.
     */
    public DeviceState effectiveStatus(Member member) {
        var snap = member.device().snapshot();
        var claimed = snap.reserved() > 0 || snap.active() > 0;
        if (snap.state().isOccupied()) {
            return claimed && !member.ringInUse() ? DeviceState.BUSY : snap.state();
        }
        if (snap.state() == DeviceState.NOT_INUSE || snap.state() == DeviceState.UNKNOWN) {
            if (snap.active() > 0) return DeviceState.INUSE;
            if (snap.reserved() > 0) return DeviceState.RINGING;
        }
        return snap.state();
    }

    /**
     * Wrap-up that applies to the member: its own override, then the wrap-up of the queue that handled
     * its last call, then this queue's.
     */
    public int wrapupSeconds(CallQueue queue, Member member) {
        if (member.wrapupSeconds() > 0) return member.wrapupSeconds();
        if (member.lastQueue() != null) return member.lastWrapupSeconds();
        return queue.settings().wrapupSeconds();
    }

    public boolean inWrapup(CallQueue queue, Member member, Instant now) {
        var lastCall = member.lastCall();
        if (lastCall == null) return false;
        var wrapup = wrapupSeconds(queue, member);
        return wrapup > 0 && Duration.between(lastCall, now).toSeconds() < wrapup;
    }

    /**
     * Per-member availability used for turn counting: device may ring, member not paused and out of wrap-up.
     */
    public boolean isMemberAvailable(CallQueue queue, Member member) {
        var available = switch (effectiveStatus(member)) {
            case INVALID, UNAVAILABLE -> false;
            case INUSE, BUSY, RINGING, RINGINUSE, ONHOLD -> member.ringInUse() && !member.paused();
            case NOT_INUSE, UNKNOWN -> !member.paused();
        };
        if (inWrapup(queue, member, clock.instant())) return false;
        return available;
    }

    /**
     * @return 0 when nobody is available; stops at 1 for ring-all or when autofill is off
     */
    public int numAvailableMembers(CallQueue queue) {
        return numAvailableMembers(queue, PenaltyBand.NONE);
    }

    /**
     * Same count restricted to the members {@code band} lets the caller ring. The band only counts once
     * the roster reaches the queue's penalty-members limit.
     */
    public int numAvailableMembers(CallQueue queue, PenaltyBand band) {
        var settings = queue.settings();
        var stopAtOne = !settings.autofill() || settings.strategy() == Strategy.RINGALL;
        var members = queue.members().snapshot();
        var usePenalty = members.size() >= settings.penaltyMembersLimit();
        var count = 0;
        for (var member : members) {
            if (usePenalty && band.excludes(band.raised(member.penalty()))) continue;
            if (!isMemberAvailable(queue, member)) continue;
            count++;
            if (stopAtOne) break;
        }
        return count;
    }

    /**
     * Join-empty and leave-when-empty check: true as soon as one member clears every condition in
     * {@code conditions}. An empty roster never has anyone available.
     */
    public boolean memberAvailable(CallQueue queue, PenaltyBand band, Set<EmptyCondition> conditions) {
        var now = clock.instant();
        for (var member : queue.members().snapshot()) {
            var penalty = band.raised(member.penalty());
            if (band.excludes(penalty) && conditions.contains(EmptyCondition.PENALTY)) {
                continue;
            }
            var blocked = switch (effectiveStatus(member)) {
                case INVALID -> conditions.contains(EmptyCondition.INVALID);
                case UNAVAILABLE -> conditions.contains(EmptyCondition.UNAVAILABLE);
                case INUSE -> conditions.contains(EmptyCondition.INUSE);
                case RINGING -> conditions.contains(EmptyCondition.RINGING);
                case UNKNOWN -> conditions.contains(EmptyCondition.UNKNOWN);
                default -> false;
            };
            if (blocked) continue;
            if (member.paused() && conditions.contains(EmptyCondition.PAUSED)) continue;
            if (conditions.contains(EmptyCondition.WRAPUP) && inWrapup(queue, member, now)) continue;
            log.debug("member_available queue={} member={}", queue.name(), member.iface());
            return true;
        }
        return false;
    }

    /**
     * Last check before a member is dialed.
     */
    public boolean canRing(CallQueue queue, Member member) {
        if (member.paused()) {
            log.debug("member_paused queue={} member={}", queue.name(), member.iface());
            return false;
        }
        if (!member.ringInUse() && !effectiveStatus(member).acceptsNewCall()) {
            log.debug("member_not_available queue={} member={}", queue.name(), member.iface());
            return false;
        }
        var wrapup = wrapupSeconds(queue, member);
        if (member.inCall() && wrapup > 0) {
            log.debug("member_in_call queue={} member={}", queue.name(), member.iface());
            return false;
        }
        if (inWrapup(queue, member, clock.instant())) {
            log.debug("member_in_wrapup queue={} member={}", queue.name(), member.iface());
            return false;
        }
        return true;
    }
}
