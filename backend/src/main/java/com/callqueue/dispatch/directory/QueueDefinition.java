package com.callqueue.dispatch.directory;

import com.callqueue.dispatch.member.MemberConfig;

import java.util.List;
import java.util.Map;

/**
 * Queue parameters plus the members configured alongside them. Realtime queues carry no members here;
 * theirs are loaded separately.
 */
public record QueueDefinition(
        String name,
        DefinitionSource source,
        Map<String, String> parameters,
        List<MemberConfig> members
) {
    public QueueDefinition {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        members = members == null ? List.of() : List.copyOf(members);
    }
}
