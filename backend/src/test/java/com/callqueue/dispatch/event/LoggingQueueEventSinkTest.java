package com.callqueue.dispatch.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LoggingQueueEventSinkTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final LoggingQueueEventSink sink = new LoggingQueueEventSink(new ObjectMapper(), registry);

    @Test
    void counts_log_records_per_event() {
        sink.logEvent("q", "c1", "PJSIP/a", QueueLogEvent.CONNECT, "3|leg-1|2");
        sink.logEvent("q", "c2", null, QueueLogEvent.CONNECT, null);
        sink.logEvent("q", "c3", "", QueueLogEvent.ABANDON, "1|1|9");
        sink.logEvent("q", "c4", "", null, "");

        assertEquals(2.0, registry.get("callqueue.queue_log.records").tag("event", "CONNECT").counter().count());
        assertEquals(1.0, registry.get("callqueue.queue_log.records").tag("event", "ABANDON").counter().count());
    }

    @Test
    void notifications_tolerate_null_values() {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("Queue", "q");
        fields.put("Reason", null);
        fields.put("Paused", true);

        assertDoesNotThrow(() -> sink.notify("QueueMemberPause", fields));
        assertDoesNotThrow(() -> sink.notify("", fields));
    }
}
