package com.callqueue.dispatch.testsupport;

import com.callqueue.dispatch.caller.QueueOutcome;
import com.callqueue.dispatch.caller.QueueRequest;
import com.callqueue.dispatch.caller.service.AnnouncementService;
import com.callqueue.dispatch.caller.service.CallConnector;
import com.callqueue.dispatch.caller.service.QueueCallerService;
import com.callqueue.dispatch.caller.service.QueueMembership;
import com.callqueue.dispatch.caller.service.TurnEvaluator;
import com.callqueue.dispatch.common.config.DispatchProperties;
import com.callqueue.dispatch.member.DeviceRegistry;
import com.callqueue.dispatch.member.DeviceState;
import com.callqueue.dispatch.member.service.MemberService;
import com.callqueue.dispatch.member.service.MemberStatusService;
import com.callqueue.dispatch.penalty.PenaltyRuleEvaluator;
import com.callqueue.dispatch.penalty.QueuePreemptionService;
import com.callqueue.dispatch.penalty.RuleRegistry;
import com.callqueue.dispatch.queue.CallQueue;
import com.callqueue.dispatch.queue.QueueRegistry;
import com.callqueue.dispatch.queue.service.QueueConfigurationService;
import com.callqueue.dispatch.ring.AnswerMultiplexer;
import com.callqueue.dispatch.ring.RingNoAnswerHandler;
import com.callqueue.dispatch.ring.RingOrchestrator;
import com.callqueue.dispatch.strategy.FewestCallsMetricStrategy;
import com.callqueue.dispatch.strategy.LeastRecentMetricStrategy;
import com.callqueue.dispatch.strategy.LinearMetricStrategy;
import com.callqueue.dispatch.strategy.MetricCalculator;
import com.callqueue.dispatch.strategy.MetricStrategyResolver;
import com.callqueue.dispatch.strategy.RandomMetricStrategy;
import com.callqueue.dispatch.strategy.RingAllMetricStrategy;
import com.callqueue.dispatch.strategy.RoundRobinMetricStrategy;
import com.callqueue.dispatch.strategy.WeightedRandomMetricStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatch core wired by hand around a scripted transport, an in-memory directory and a recording sink.
 */
public class DispatchFixture {

    public final Clock clock = Clock.systemUTC();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final RecordingEventSink events = new RecordingEventSink();
    public final FakeTelephony telephony = new FakeTelephony();
    public final InMemoryQueueDirectory directory = new InMemoryQueueDirectory();
    public final DeviceRegistry deviceRegistry = new DeviceRegistry();
    public final RuleRegistry ruleRegistry = new RuleRegistry();
    public final DispatchProperties props;

    public final QueueRegistry queueRegistry;
    public final MemberStatusService statusService;
    public final MemberService memberService;
    public final QueueConfigurationService configuration;
    public final MetricCalculator metricCalculator;
    public final QueuePreemptionService preemption;
    public final RingNoAnswerHandler noAnswerHandler;
    public final RingOrchestrator ringOrchestrator;
    public final QueueMembership membership;
    public final TurnEvaluator turnEvaluator;
    public final AnnouncementService announcements;
    public final PenaltyRuleEvaluator ruleEvaluator = new PenaltyRuleEvaluator();
    public final CallConnector connector;
    public final QueueCallerService callers;

    public DispatchFixture() {
        this(new DispatchProperties(false, true, false, 50, 0));
    }

    public DispatchFixture(DispatchProperties props) {
        this.props = props;
        queueRegistry = new QueueRegistry(deviceRegistry);
        statusService = new MemberStatusService(clock);
        memberService = new MemberService(queueRegistry, deviceRegistry, directory, events, props, clock);
        configuration = new QueueConfigurationService(directory, queueRegistry, ruleRegistry, memberService);
        metricCalculator = new MetricCalculator(new MetricStrategyResolver(List.of(
                new RingAllMetricStrategy(),
                new LinearMetricStrategy(),
                new RoundRobinMetricStrategy(),
                new RandomMetricStrategy(),
                new WeightedRandomMetricStrategy(),
                new FewestCallsMetricStrategy(),
                new LeastRecentMetricStrategy()
        )), clock);
        preemption = new QueuePreemptionService(queueRegistry, statusService);
        noAnswerHandler = new RingNoAnswerHandler(memberService, events, clock, meterRegistry);
        ringOrchestrator = new RingOrchestrator(metricCalculator, statusService, memberService, preemption, queueRegistry,
                telephony, new AnswerMultiplexer(noAnswerHandler, clock), events, clock, meterRegistry);
        membership = new QueueMembership(statusService, events);
        turnEvaluator = new TurnEvaluator(statusService);
        announcements = new AnnouncementService(clock);
        connector = new CallConnector(membership, memberService, telephony, events, clock, meterRegistry);
        callers = new QueueCallerService(queueRegistry, ruleRegistry, membership, turnEvaluator, announcements,
                ruleEvaluator, ringOrchestrator, connector, statusService, memberService, configuration, events,
                props, clock, meterRegistry);
    }

    /**
     * Defines a static queue and loads it the way a reload would.
     */
    public CallQueue queue(String name, Map<String, String> params, String... memberLines) {
        directory.define(name, params, memberLines);
        configuration.reload();
        return queueRegistry.require(name);
    }

    public void deviceState(String deviceId, DeviceState state) {
        deviceRegistry.update(deviceId, state);
    }

    public CompletableFuture<QueueOutcome> enterAsync(FakeCallerSession session, QueueRequest request) {
        return CompletableFuture.supplyAsync(() -> callers.enter(session, request), runnable -> {
            var t = new Thread(runnable, "caller-" + session.callId());
            t.setDaemon(true);
            t.start();
        });
    }
}
