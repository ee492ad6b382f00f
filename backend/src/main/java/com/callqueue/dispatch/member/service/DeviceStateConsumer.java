package com.callqueue.dispatch.member.service;

import com.callqueue.dispatch.common.config.DispatchProperties;
import com.callqueue.dispatch.devicestate.DeviceStateBus;
import com.callqueue.dispatch.devicestate.DeviceStateChange;
import com.callqueue.dispatch.event.QueueEventSink;
import com.callqueue.dispatch.member.DeviceRegistry;
import com.callqueue.dispatch.queue.QueueRegistry;
import com.callqueue.dispatch.session.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Applies device state changes off the publisher's thread, in arrival order, then tells listeners
 * which queue members were affected.
 */
@Service
public class DeviceStateConsumer {

    private static final Logger log = LoggerFactory.getLogger(DeviceStateConsumer.class);

    private final DeviceStateBus bus;
    private final DeviceRegistry deviceRegistry;
    private final QueueRegistry queueRegistry;
    private final MemberStatusService statusService;
    private final MemberService memberService;
    private final QueueEventSink eventSink;
    private final ThreadPoolExecutor executor;

    private Subscription subscription;

    public DeviceStateConsumer(
            DeviceStateBus bus,
            DeviceRegistry deviceRegistry,
            QueueRegistry queueRegistry,
            MemberStatusService statusService,
            MemberService memberService,
            QueueEventSink eventSink,
            DispatchProperties props
    ) {
        this.bus = bus;
        this.deviceRegistry = deviceRegistry;
        this.queueRegistry = queueRegistry;
        this.statusService = statusService;
        this.memberService = memberService;
        this.eventSink = eventSink;
        this.executor = new ThreadPoolExecutor(
                1,
                1,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(props.effectiveDeviceStateQueueCapacity()),
                r -> {
                    var t = new Thread(r, "device-state");
                    t.setDaemon(true);
                    return t;
                }
        );
    }

    @PostConstruct
    public void start() {
        subscription = bus.subscribe(this::submit);
    }

    public void submit(DeviceStateChange change) {
        try {
            executor.execute(() -> apply(change));
        } catch (RejectedExecutionException e) {
            log.warn("device_state_dropped device={} state={}", change.deviceId(), change.state(), e);
        }
    }

    void apply(DeviceStateChange change) {
        try {
            if (!deviceRegistry.update(change.deviceId(), change.state())) {
                log.debug("device_state_untracked device={}", change.deviceId());
                return;
            }
            for (var queue : queueRegistry.activeQueues()) {
                for (var member : queue.members().snapshot()) {
                    if (!member.stateInterface().equalsIgnoreCase(change.deviceId())) continue;
                    var fields = memberService.memberFields(queue, member);
                    fields.put("Status", statusService.effectiveStatus(member).name());
                    eventSink.notify("QueueMemberStatus", fields);
                }
            }
        } catch (RuntimeException e) {
            log.warn("device_state_apply_failed device={}", change.deviceId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) subscription.close();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                var dropped = executor.shutdownNow();
                log.debug("device_state_executor_forced dropped={}", dropped.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
