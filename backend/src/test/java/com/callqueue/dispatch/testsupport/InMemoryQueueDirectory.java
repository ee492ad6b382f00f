package com.callqueue.dispatch.testsupport;

import com.callqueue.dispatch.directory.DefinitionSource;
import com.callqueue.dispatch.directory.QueueDefinition;
import com.callqueue.dispatch.directory.QueueDirectory;
import com.callqueue.dispatch.member.MemberConfig;
import com.callqueue.dispatch.member.MemberLineParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryQueueDirectory implements QueueDirectory {

    public record PauseUpdate(String uniqueId, boolean paused, String reason) {
    }

    private final Map<String, QueueDefinition> queues = new LinkedHashMap<>();
    private final Map<String, List<String>> rules = new LinkedHashMap<>();
    private final Map<String, List<MemberConfig>> realtimeMembers = new ConcurrentHashMap<>();
    private final Map<String, List<MemberConfig>> persisted = new ConcurrentHashMap<>();
    private final List<PauseUpdate> pauseUpdates = new CopyOnWriteArrayList<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public synchronized InMemoryQueueDirectory define(String name, Map<String, String> params, String... memberLines) {
        var members = Arrays.stream(memberLines).map(MemberLineParser::parse).toList();
        queues.put(name, new QueueDefinition(name, DefinitionSource.STATIC, params, members));
        return this;
    }

    public synchronized InMemoryQueueDirectory defineRealtime(String name, Map<String, String> params) {
        queues.put(name, new QueueDefinition(name, DefinitionSource.REALTIME, params, List.of()));
        return this;
    }

    public synchronized InMemoryQueueDirectory drop(String name) {
        queues.remove(name);
        return this;
    }

    public synchronized InMemoryQueueDirectory rule(String name, String... lines) {
        rules.put(name, List.of(lines));
        return this;
    }

    public InMemoryQueueDirectory realtimeMembers(String queueName, MemberConfig... members) {
        realtimeMembers.put(queueName, List.of(members));
        return this;
    }

    public InMemoryQueueDirectory persisted(String queueName, MemberConfig... members) {
        persisted.put(queueName, List.of(members));
        return this;
    }

    public List<MemberConfig> persistedFor(String queueName) {
        return persisted.getOrDefault(queueName, List.of());
    }

    public List<PauseUpdate> pauseUpdates() {
        return List.copyOf(pauseUpdates);
    }

    public void fireReload() {
        for (var l : listeners) {
            l.run();
        }
    }

    @Override
    public synchronized List<QueueDefinition> loadQueues() {
        return new ArrayList<>(queues.values());
    }

    @Override
    public synchronized Map<String, List<String>> loadRules() {
        return new LinkedHashMap<>(rules);
    }

    @Override
    public List<MemberConfig> loadRealtimeMembers(String queueName) {
        return realtimeMembers.getOrDefault(queueName, List.of());
    }

    @Override
    public List<MemberConfig> loadPersistedMembers(String queueName) {
        return persisted.getOrDefault(queueName, List.of());
    }

    @Override
    public void persistDynamicMembers(String queueName, List<MemberConfig> members) {
        persisted.put(queueName, List.copyOf(members));
    }

    @Override
    public void updateRealtimePause(String uniqueId, boolean paused, String reason) {
        pauseUpdates.add(new PauseUpdate(uniqueId, paused, reason));
    }

    @Override
    public void addReloadListener(Runnable listener) {
        listeners.add(listener);
    }
}
