package com.callqueue.dispatch.event;

import java.util.Map;

/**
 * One-way sink for queue-log records and manager notifications. Never consulted for decisions.
 */
public interface QueueEventSink {

    void logEvent(String queue, String callId, String member, QueueLogEvent event, String info);

    void notify(String eventType, Map<String, Object> fields);
}
