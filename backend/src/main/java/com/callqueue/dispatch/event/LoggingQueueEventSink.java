package com.callqueue.dispatch.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Component
public class LoggingQueueEventSink implements QueueEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingQueueEventSink.class);
    private static final Logger queueLog = LoggerFactory.getLogger("queue_log");
    private static final Logger eventLog = LoggerFactory.getLogger("queue_events");

    private final ObjectMapper objectMapper;
    private final Map<QueueLogEvent, Counter> logCounters = new EnumMap<>(QueueLogEvent.class);

    public LoggingQueueEventSink(ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;
        for (var event : QueueLogEvent.values()) {
            logCounters.put(event, Counter.builder("callqueue.queue_log.records")
                    .description("Queue-log records written, by event")
                    .tag("event", event.name())
                    .register(meterRegistry));
        }
    }

    @Override
    public void logEvent(String queue, String callId, String member, QueueLogEvent event, String info) {
        if (event == null) return;
        queueLog.info("{}|{}|{}|{}|{}",
                queue == null ? "NONE" : queue,
                callId == null ? "NONE" : callId,
                member == null || member.isBlank() ? "NONE" : member,
                event.name(),
                info == null ? "" : info);
        logCounters.get(event).increment();
    }

    @Override
    public void notify(String eventType, Map<String, Object> fields) {
        if (eventType == null || eventType.isBlank()) return;
        var evt = objectMapper.createObjectNode();
        evt.put("event", eventType);
        if (fields != null) {
            for (var e : fields.entrySet()) {
                evt.set(e.getKey(), objectMapper.valueToTree(e.getValue()));
            }
        }
        try {
            eventLog.info(objectMapper.writeValueAsString(evt));
        } catch (JsonProcessingException e) {
            log.warn("queue_event_serialize_failed event={}", eventType, e);
        }
    }
}
