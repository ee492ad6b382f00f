package com.callqueue.dispatch.directory;

import com.callqueue.dispatch.common.config.DispatchProperties;
import com.callqueue.dispatch.common.error.InvalidQueueConfigException;
import com.callqueue.dispatch.directory.repo.PersistedMemberRepository;
import com.callqueue.dispatch.directory.repo.RealtimeMemberRepository;
import com.callqueue.dispatch.directory.repo.RealtimeQueueRepository;
import com.callqueue.dispatch.member.MemberConfig;
import com.callqueue.dispatch.member.MemberLineParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Directory backed by application configuration for static queues and JDBC tables for realtime
 * queues, realtime members and persisted dynamic rosters.
 */
@Component
public class DirectoryQueueSource implements QueueDirectory {

    private static final Logger log = LoggerFactory.getLogger(DirectoryQueueSource.class);

    private static final TypeReference<List<PersistedMember>> ROSTER_TYPE = new TypeReference<>() {
    };

    private final StaticQueueProperties staticConfig;
    private final RealtimeQueueRepository realtimeQueueRepository;
    private final RealtimeMemberRepository realtimeMemberRepository;
    private final PersistedMemberRepository persistedMemberRepository;
    private final ObjectMapper objectMapper;
    private final boolean realtimeEnabled;

    private final List<Runnable> reloadListeners = new CopyOnWriteArrayList<>();

    public DirectoryQueueSource(
            StaticQueueProperties staticConfig,
            RealtimeQueueRepository realtimeQueueRepository,
            RealtimeMemberRepository realtimeMemberRepository,
            PersistedMemberRepository persistedMemberRepository,
            ObjectMapper objectMapper,
            DispatchProperties props
    ) {
        this.staticConfig = staticConfig;
        this.realtimeQueueRepository = realtimeQueueRepository;
        this.realtimeMemberRepository = realtimeMemberRepository;
        this.persistedMemberRepository = persistedMemberRepository;
        this.objectMapper = objectMapper;
        this.realtimeEnabled = props.realtimeEnabled();
    }

    @Override
    public List<QueueDefinition> loadQueues() {
        var out = new ArrayList<QueueDefinition>();
        var names = new HashSet<String>();
        for (var e : staticConfig.queues().entrySet()) {
            var block = e.getValue();
            var members = new ArrayList<MemberConfig>();
            for (var line : block.members()) {
                try {
                    members.add(MemberLineParser.parse(line));
                } catch (InvalidQueueConfigException ex) {
                    log.warn("static_member_rejected queue={} line={} reason={}", e.getKey(), line, ex.getMessage());
                }
            }
            out.add(new QueueDefinition(e.getKey(), DefinitionSource.STATIC, block.settings(), members));
            names.add(e.getKey());
        }
        if (realtimeEnabled) {
            for (var e : realtimeQueueRepository.loadAll().entrySet()) {
                if (names.contains(e.getKey())) {
                    log.debug("realtime_queue_shadowed queue={}", e.getKey());
                    continue;
                }
                out.add(new QueueDefinition(e.getKey(), DefinitionSource.REALTIME, e.getValue(), List.of()));
            }
        }
        return out;
    }

    @Override
    public Map<String, List<String>> loadRules() {
        return staticConfig.rules();
    }

    @Override
    public List<MemberConfig> loadRealtimeMembers(String queueName) {
        if (!realtimeEnabled) return List.of();
        var out = new ArrayList<MemberConfig>();
        for (var row : realtimeMemberRepository.findByQueue(queueName)) {
            if (row.iface() == null || row.iface().isBlank()) {
                log.warn("realtime_member_rejected queue={} uniqueid={} reason=interface_missing", queueName, row.uniqueId());
                continue;
            }
            out.add(new MemberConfig(row.iface(), row.memberName(), row.stateInterface(), row.penalty(), row.paused(),
                    row.reasonPaused(), row.wrapupSeconds(), row.ringInUse(), row.uniqueId()));
        }
        return out;
    }

    @Override
    public List<MemberConfig> loadPersistedMembers(String queueName) {
        var json = persistedMemberRepository.findRoster(queueName).orElse(null);
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, ROSTER_TYPE).stream().map(PersistedMember::toConfig).toList();
        } catch (JsonProcessingException e) {
            log.warn("persisted_roster_unreadable queue={}", queueName, e);
            return List.of();
        }
    }

    @Override
    public void persistDynamicMembers(String queueName, List<MemberConfig> members) {
        if (members == null || members.isEmpty()) {
            persistedMemberRepository.deleteRoster(queueName);
            return;
        }
        try {
            var json = objectMapper.writeValueAsString(members.stream().map(PersistedMember::from).toList());
            persistedMemberRepository.upsertRoster(queueName, json);
        } catch (JsonProcessingException e) {
            log.warn("persisted_roster_write_failed queue={}", queueName, e);
        }
    }

    @Override
    public void updateRealtimePause(String uniqueId, boolean paused, String reason) {
        if (!realtimeEnabled || uniqueId == null || uniqueId.isBlank()) return;
        realtimeMemberRepository.updatePaused(uniqueId, paused, reason);
    }

    @Override
    public void addReloadListener(Runnable listener) {
        if (listener != null) reloadListeners.add(listener);
    }

    /**
     * Signals that definitions changed; every listener reloads from this directory.
     */
    public void triggerReload() {
        for (var listener : reloadListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("queue_reload_listener_failed", e);
            }
        }
    }
}
