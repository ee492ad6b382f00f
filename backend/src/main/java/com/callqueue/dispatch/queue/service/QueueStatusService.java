package com.callqueue.dispatch.queue.service;

import com.callqueue.dispatch.member.service.MemberStatusService;
import com.callqueue.dispatch.queue.CallQueue;
import com.callqueue.dispatch.queue.QueueRegistry;
import com.callqueue.dispatch.queue.StatisticsSnapshot;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Read-only views of queues for management surfaces.
 */
@Service
public class QueueStatusService {

    public record MemberView(
            String iface,
            String memberName,
            String membership,
            int penalty,
            int calls,
            boolean paused,
            String pauseReason,
            boolean inCall,
            String status
    ) {
    }

    public record CallerView(String callId, int position, int priority, long waitSeconds, String state) {
    }

    public record QueueView(
            String name,
            String strategy,
            int maxLen,
            int weight,
            StatisticsSnapshot statistics,
            List<MemberView> members,
            List<CallerView> callers
    ) {
    }

    private final QueueRegistry queueRegistry;
    private final MemberStatusService statusService;
    private final Clock clock;

    public QueueStatusService(QueueRegistry queueRegistry, MemberStatusService statusService, Clock clock) {
        this.queueRegistry = queueRegistry;
        this.statusService = statusService;
        this.clock = clock;
    }

    public List<QueueView> listQueues() {
        return queueRegistry.activeQueues().stream().map(this::view).toList();
    }

    public Optional<QueueView> findQueue(String name) {
        return queueRegistry.find(name).map(this::view);
    }

    private QueueView view(CallQueue queue) {
        var now = clock.instant();
        var members = queue.members().snapshot().stream()
                .map(m -> new MemberView(
                        m.iface(),
                        m.memberName(),
                        m.origin().name().toLowerCase(),
                        m.penalty(),
                        m.calls(),
                        m.paused(),
                        m.pauseReason(),
                        m.inCall(),
                        statusService.effectiveStatus(m).name()))
                .toList();
        var callers = queue.waiting().snapshot().stream()
                .map(e -> new CallerView(
                        e.callId(),
                        e.position(),
                        e.priority(),
                        Math.max(0, Duration.between(e.joinedAt(), now).toSeconds()),
                        e.state().name()))
                .toList();
        var settings = queue.settings();
        return new QueueView(queue.name(), settings.strategy().key(), settings.maxLen(), settings.weight(),
                queue.statistics().snapshot(), members, callers);
    }
}
