package com.callqueue.dispatch.member.service;

import com.callqueue.dispatch.common.config.DispatchProperties;
import com.callqueue.dispatch.directory.QueueDirectory;
import com.callqueue.dispatch.event.QueueEventSink;
import com.callqueue.dispatch.event.QueueLogEvent;
import com.callqueue.dispatch.member.DeviceRegistry;
import com.callqueue.dispatch.member.Member;
import com.callqueue.dispatch.member.MemberConfig;
import com.callqueue.dispatch.member.MemberOpResult;
import com.callqueue.dispatch.member.MemberOrigin;
import com.callqueue.dispatch.queue.CallQueue;
import com.callqueue.dispatch.queue.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Roster management: dynamic add/remove, pause and penalty changes, call accounting and the
 * reconciliation of static, realtime and persisted members on load.
 */
@Service
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);

    private static final String MANAGER = "MANAGER";

    private final QueueRegistry queueRegistry;
    private final DeviceRegistry deviceRegistry;
    private final QueueDirectory directory;
    private final QueueEventSink eventSink;
    private final DispatchProperties props;
    private final Clock clock;

    public MemberService(
            QueueRegistry queueRegistry,
            DeviceRegistry deviceRegistry,
            QueueDirectory directory,
            QueueEventSink eventSink,
            DispatchProperties props,
            Clock clock
    ) {
        this.queueRegistry = queueRegistry;
        this.deviceRegistry = deviceRegistry;
        this.directory = directory;
        this.eventSink = eventSink;
        this.props = props;
        this.clock = clock;
    }

    public MemberOpResult addMember(String queueName, MemberConfig config) {
        if (config == null) return MemberOpResult.INVALID;
        var queue = queueRegistry.find(queueName).orElse(null);
        if (queue == null) return MemberOpResult.NO_SUCH_QUEUE;
        if (queue.members().contains(config.iface())) return MemberOpResult.EXISTS;

        var member = newMember(queue, config, MemberOrigin.DYNAMIC);
        if (!queue.members().add(member)) {
            deviceRegistry.release(member.device());
            return MemberOpResult.EXISTS;
        }
        eventSink.logEvent(queue.name(), MANAGER, member.memberName(), QueueLogEvent.ADDMEMBER, "");
        eventSink.notify("QueueMemberAdded", memberFields(queue, member));
        persist(queue);
        return MemberOpResult.OK;
    }

    public MemberOpResult removeMember(String queueName, String iface) {
        var queue = queueRegistry.find(queueName).orElse(null);
        if (queue == null) return MemberOpResult.NO_SUCH_QUEUE;
        var member = queue.members().find(iface).orElse(null);
        if (member == null) return MemberOpResult.NOT_FOUND;
        if (!member.isDynamic()) return MemberOpResult.NOT_DYNAMIC;

        if (queue.members().remove(iface).isEmpty()) return MemberOpResult.NOT_FOUND;
        deviceRegistry.release(member.device());
        eventSink.logEvent(queue.name(), MANAGER, member.memberName(), QueueLogEvent.REMOVEMEMBER, "");
        eventSink.notify("QueueMemberRemoved", memberFields(queue, member));
        persist(queue);
        return MemberOpResult.OK;
    }

    /**
     * @param queueName null to apply to every queue the interface belongs to
     */
    public MemberOpResult setPaused(String queueName, String iface, boolean paused, String reason) {
        return forEachMember(queueName, iface, (queue, member) -> {
            member.setPaused(paused, reason, clock.instant());
            if (member.origin() == MemberOrigin.REALTIME) {
                try {
                    directory.updateRealtimePause(member.uniqueId(), paused, reason);
                } catch (RuntimeException e) {
                    log.warn("realtime_pause_update_failed queue={} member={}", queue.name(), iface, e);
                }
            }
            eventSink.logEvent(queue.name(), MANAGER, member.memberName(),
                    paused ? QueueLogEvent.PAUSE : QueueLogEvent.UNPAUSE, reason == null ? "" : reason);
            var fields = memberFields(queue, member);
            fields.put("Paused", paused);
            fields.put("PausedReason", reason == null ? "" : reason);
            eventSink.notify("QueueMemberPause", fields);
            if (member.isDynamic()) persist(queue);
        });
    }

    public MemberOpResult setPenalty(String queueName, String iface, int penalty) {
        if (penalty < 0) return MemberOpResult.INVALID;
        return forEachMember(queueName, iface, (queue, member) -> {
            member.setPenalty(penalty);
            eventSink.logEvent(queue.name(), MANAGER, member.memberName(), QueueLogEvent.PENALTY, String.valueOf(penalty));
            var fields = memberFields(queue, member);
            fields.put("Penalty", penalty);
            eventSink.notify("QueueMemberPenalty", fields);
            if (member.isDynamic()) persist(queue);
        });
    }

    public MemberOpResult setRingInUse(String queueName, String iface, boolean ringInUse) {
        return forEachMember(queueName, iface, (queue, member) -> {
            member.setRingInUse(ringInUse);
            var fields = memberFields(queue, member);
            fields.put("Ringinuse", ringInUse);
            eventSink.notify("QueueMemberRinginuse", fields);
            if (member.isDynamic()) persist(queue);
        });
    }

    /**
     * Accounts a completed call. With shared last-call the member entry of the same interface in every
     * queue is updated, so wrap-up and least-recent ranking see the call everywhere.
     */
    public void recordCallCompleted(CallQueue queue, Member member) {
        var now = clock.instant();
        var wrapup = queue.settings().wrapupSeconds();
        if (!props.sharedLastCall()) {
            member.recordCall(now, queue.name(), wrapup);
            return;
        }
        var updated = false;
        for (var q : queueRegistry.activeQueues()) {
            var same = q.members().find(member.iface()).orElse(null);
            if (same == null) continue;
            same.recordCall(now, queue.name(), wrapup);
            updated |= same == member;
        }
        if (!updated) {
            // the queue may have been reloaded away while the call was bridged
            member.recordCall(now, queue.name(), wrapup);
        }
    }

    /**
     * Brings the static part of the roster in line with configuration. Static members replace realtime or
     * dynamic ones with the same interface.
     */
    public void reconcileStaticMembers(CallQueue queue, List<MemberConfig> configs) {
        var roster = queue.members();
        var wanted = new HashSet<String>();
        for (var config : configs) {
            wanted.add(config.iface().toLowerCase());
            var existing = roster.find(config.iface()).orElse(null);
            if (existing != null && existing.origin() == MemberOrigin.STATIC) {
                existing.update(config, queue.settings().ringInUse());
                continue;
            }
            if (existing != null) {
                log.info("member_shadowed_by_static queue={} member={} origin={}", queue.name(), existing.iface(), existing.origin());
                unlink(queue, existing);
            }
            var member = newMember(queue, config, MemberOrigin.STATIC);
            if (!roster.add(member)) deviceRegistry.release(member.device());
        }
        for (var member : roster.snapshot()) {
            if (member.origin() == MemberOrigin.STATIC && !wanted.contains(member.iface().toLowerCase())) {
                unlink(queue, member);
            }
        }
    }

    /**
     * Re-reads realtime members of a queue. A unique id that shows up for a second interface is rejected
     * and the member already holding it is kept.
     */
    public void refreshRealtimeMembers(String queueName) {
        var queue = queueRegistry.find(queueName).orElse(null);
        if (queue == null) return;
        List<MemberConfig> rows;
        try {
            rows = directory.loadRealtimeMembers(queueName);
        } catch (RuntimeException e) {
            log.warn("realtime_members_load_failed queue={}", queueName, e);
            return;
        }

        var roster = queue.members();
        var seen = new HashSet<String>();
        for (var row : rows) {
            var uniqueId = row.uniqueId();
            if (uniqueId == null || uniqueId.isBlank()) {
                log.warn("realtime_member_uniqueid_missing queue={} member={}", queueName, row.iface());
                continue;
            }
            if (!seen.add(uniqueId)) {
                log.warn("realtime_member_duplicate queue={} uniqueid={} member={}", queueName, uniqueId, row.iface());
                continue;
            }
            var holder = roster.findByUniqueId(uniqueId).orElse(null);
            if (holder != null && !holder.sameInterface(row.iface())) {
                log.warn("realtime_member_duplicate queue={} uniqueid={} member={} kept={}", queueName, uniqueId, row.iface(), holder.iface());
                continue;
            }
            var existing = roster.find(row.iface()).orElse(null);
            if (existing != null) {
                switch (existing.origin()) {
                    case STATIC -> log.debug("realtime_member_shadowed queue={} member={}", queueName, row.iface());
                    case REALTIME -> existing.update(row, queue.settings().ringInUse());
                    case DYNAMIC -> {
                        unlink(queue, existing);
                        addQuietly(queue, row, MemberOrigin.REALTIME);
                    }
                }
                continue;
            }
            addQuietly(queue, row, MemberOrigin.REALTIME);
        }
        for (var member : roster.snapshot()) {
            if (member.origin() == MemberOrigin.REALTIME && !seen.contains(member.uniqueId())) {
                unlink(queue, member);
            }
        }
    }

    /**
     * Re-adds dynamic members saved by a previous run. Interfaces already present win.
     */
    public void restorePersistedMembers(CallQueue queue) {
        if (!props.persistentMembers()) return;
        List<MemberConfig> saved;
        try {
            saved = directory.loadPersistedMembers(queue.name());
        } catch (RuntimeException e) {
            log.warn("persisted_members_load_failed queue={}", queue.name(), e);
            return;
        }
        for (var config : saved) {
            if (queue.members().contains(config.iface())) continue;
            addQuietly(queue, config, MemberOrigin.DYNAMIC);
        }
        log.info("persisted_members_restored queue={} count={}", queue.name(), saved.size());
    }

    public List<Member> findAcrossQueues(String iface) {
        var out = new ArrayList<Member>();
        for (var q : queueRegistry.activeQueues()) {
            q.members().find(iface).ifPresent(out::add);
        }
        return out;
    }

    public Map<String, Object> memberFields(CallQueue queue, Member member) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("Queue", queue.name());
        fields.put("MemberName", member.memberName());
        fields.put("Interface", member.iface());
        fields.put("StateInterface", member.stateInterface());
        fields.put("Membership", member.origin().name().toLowerCase());
        fields.put("Penalty", member.penalty());
        fields.put("CallsTaken", member.calls());
        fields.put("Paused", member.paused());
        return fields;
    }

    private MemberOpResult forEachMember(String queueName, String iface, BiConsumer<CallQueue, Member> action) {
        List<CallQueue> targets;
        if (queueName == null || queueName.isBlank()) {
            targets = queueRegistry.activeQueues();
        } else {
            var queue = queueRegistry.find(queueName).orElse(null);
            if (queue == null) return MemberOpResult.NO_SUCH_QUEUE;
            targets = List.of(queue);
        }
        var found = false;
        for (var queue : targets) {
            var member = queue.members().find(iface).orElse(null);
            if (member == null) continue;
            action.accept(queue, member);
            found = true;
        }
        return found ? MemberOpResult.OK : MemberOpResult.NOT_FOUND;
    }

    private Member newMember(CallQueue queue, MemberConfig config, MemberOrigin origin) {
        var device = deviceRegistry.acquire(config.stateInterface());
        return new Member(config, origin, device, queue.settings().ringInUse());
    }

    private void addQuietly(CallQueue queue, MemberConfig config, MemberOrigin origin) {
        var member = newMember(queue, config, origin);
        if (!queue.members().add(member)) {
            deviceRegistry.release(member.device());
        }
    }

    private void unlink(CallQueue queue, Member member) {
        var removed = queue.members().remove(member.iface()).orElse(null);
        if (removed != null) deviceRegistry.release(removed.device());
    }

    private void persist(CallQueue queue) {
        if (!props.persistentMembers()) return;
        var dynamic = queue.members().snapshot().stream()
                .filter(Member::isDynamic)
                .map(Member::toConfig)
                .toList();
        try {
            directory.persistDynamicMembers(queue.name(), dynamic);
        } catch (RuntimeException e) {
            log.warn("persist_dynamic_members_failed queue={}", queue.name(), e);
        }
    }
}
