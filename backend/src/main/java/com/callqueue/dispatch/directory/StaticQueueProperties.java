package com.callqueue.dispatch.directory;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Queues, members and penalty rules from application configuration.
 */
@ConfigurationProperties(prefix = "app.queue-config")
public record StaticQueueProperties(
        Map<String, QueueBlock> queues,
        Map<String, List<String>> rules
) {

    public StaticQueueProperties {
        queues = queues == null ? Map.of() : queues;
        rules = rules == null ? Map.of() : rules;
    }

    /**
     * @param members member lines, see {@link com.callqueue.dispatch.member.MemberLineParser}
     */
    public record QueueBlock(Map<String, String> settings, List<String> members) {
        public QueueBlock {
            settings = settings == null ? Map.of() : settings;
            members = members == null ? List.of() : members;
        }
    }
}
