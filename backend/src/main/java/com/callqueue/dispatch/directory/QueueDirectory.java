package com.callqueue.dispatch.directory;

import com.callqueue.dispatch.member.MemberConfig;

import java.util.List;
import java.util.Map;

/**
 * Source of queue and member definitions. Static definitions shadow realtime ones of the same name.
 */
public interface QueueDirectory {

    List<QueueDefinition> loadQueues();

    /**
     * Rule name to its raw penalty change lines.
     */
    Map<String, List<String>> loadRules();

    List<MemberConfig> loadRealtimeMembers(String queueName);

    List<MemberConfig> loadPersistedMembers(String queueName);

    void persistDynamicMembers(String queueName, List<MemberConfig> members);

    void updateRealtimePause(String uniqueId, boolean paused, String reason);

    void addReloadListener(Runnable listener);
}
