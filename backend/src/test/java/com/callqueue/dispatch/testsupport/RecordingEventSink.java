package com.callqueue.dispatch.testsupport;

import com.callqueue.dispatch.event.QueueEventSink;
import com.callqueue.dispatch.event.QueueLogEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RecordingEventSink implements QueueEventSink {

    public record LogRecord(String queue, String callId, String member, QueueLogEvent event, String info) {
    }

    public record Notification(String type, Map<String, Object> fields) {
    }

    private final List<LogRecord> records = new ArrayList<>();
    private final List<Notification> notifications = new ArrayList<>();

    @Override
    public synchronized void logEvent(String queue, String callId, String member, QueueLogEvent event, String info) {
        records.add(new LogRecord(queue, callId, member, event, info));
    }

    @Override
    public synchronized void notify(String eventType, Map<String, Object> fields) {
        notifications.add(new Notification(eventType, new LinkedHashMap<>(fields)));
    }

    public synchronized List<LogRecord> records() {
        return List.copyOf(records);
    }

    public synchronized List<LogRecord> records(QueueLogEvent event) {
        return records.stream().filter(r -> r.event() == event).toList();
    }

    public synchronized List<Notification> notifications(String type) {
        return notifications.stream().filter(n -> n.type().equals(type)).toList();
    }
}
