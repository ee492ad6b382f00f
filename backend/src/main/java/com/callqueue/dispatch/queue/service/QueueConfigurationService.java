package com.callqueue.dispatch.queue.service;

import com.callqueue.dispatch.directory.DefinitionSource;
import com.callqueue.dispatch.directory.QueueDirectory;
import com.callqueue.dispatch.member.service.MemberService;
import com.callqueue.dispatch.penalty.PenaltyRuleParser;
import com.callqueue.dispatch.penalty.RuleList;
import com.callqueue.dispatch.penalty.RuleRegistry;
import com.callqueue.dispatch.queue.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads rules, queues and rosters from the directory at startup and again on every reload signal.
 * Queues missing from a reload are deactivated; their waiting callers finish on the old generation.
 */
@Service
public class QueueConfigurationService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(QueueConfigurationService.class);

    private final QueueDirectory directory;
    private final QueueRegistry queueRegistry;
    private final RuleRegistry ruleRegistry;
    private final MemberService memberService;

    private final Set<String> restored = ConcurrentHashMap.newKeySet();
    private final Set<String> realtimeQueues = ConcurrentHashMap.newKeySet();

    public QueueConfigurationService(
            QueueDirectory directory,
            QueueRegistry queueRegistry,
            RuleRegistry ruleRegistry,
            MemberService memberService
    ) {
        this.directory = directory;
        this.queueRegistry = queueRegistry;
        this.ruleRegistry = ruleRegistry;
        this.memberService = memberService;
    }

    @Override
    public void run(ApplicationArguments args) {
        reload();
        directory.addReloadListener(this::reload);
    }

    public synchronized void reload() {
        reloadRules();

        var definitions = directory.loadQueues();
        var seen = new HashSet<String>();
        for (var def : definitions) {
            try {
                var settings = QueueSettingsParser.parse(def.name(), def.parameters());
                var queue = queueRegistry.activate(settings);
                seen.add(queue.name());

                var isRealtime = def.source() == DefinitionSource.REALTIME;
                memberService.reconcileStaticMembers(queue, isRealtime ? List.of() : def.members());
                if (isRealtime) {
                    realtimeQueues.add(queue.name());
                    memberService.refreshRealtimeMembers(queue.name());
                } else {
                    realtimeQueues.remove(queue.name());
                }
                if (restored.add(queue.name())) {
                    memberService.restorePersistedMembers(queue);
                }
            } catch (RuntimeException e) {
                log.warn("queue_load_failed queue={}", def.name(), e);
            }
        }

        for (var name : queueRegistry.names()) {
            if (seen.contains(name)) continue;
            queueRegistry.deactivate(name);
            realtimeQueues.remove(name);
            restored.remove(name);
        }
        log.info("queues_loaded count={} rules={}", seen.size(), ruleRegistry.size());
    }

    /**
     * Re-reads members of every realtime queue.
     */
    public void refreshRealtimeQueues() {
        for (var name : realtimeQueues) {
            memberService.refreshRealtimeMembers(name);
        }
    }

    public boolean isRealtime(String queueName) {
        return queueName != null && realtimeQueues.contains(queueName);
    }

    private void reloadRules() {
        var raw = directory.loadRules();
        var parsed = new HashMap<String, RuleList>();
        for (var e : raw.entrySet()) {
            parsed.put(e.getKey(), PenaltyRuleParser.parse(e.getKey(), e.getValue()));
        }
        ruleRegistry.replaceAll(parsed);
    }
}
