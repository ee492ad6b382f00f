package com.callqueue.dispatch.caller.service;

import com.callqueue.dispatch.caller.EntryState;
import com.callqueue.dispatch.caller.PenaltyBand;
import com.callqueue.dispatch.caller.QueueOption;
import com.callqueue.dispatch.caller.QueueRequest;
import com.callqueue.dispatch.caller.QueueResult;
import com.callqueue.dispatch.common.error.QueueNotFoundException;
import com.callqueue.dispatch.event.QueueLogEvent;
import com.callqueue.dispatch.telephony.LegSignalType;
import com.callqueue.dispatch.testsupport.Await;
import com.callqueue.dispatch.testsupport.DispatchFixture;
import com.callqueue.dispatch.testsupport.FakeCallerSession;
import com.callqueue.dispatch.testsupport.FakeTelephony.Script;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static com.callqueue.dispatch.caller.EntryState.DIALING;
import static com.callqueue.dispatch.caller.EntryState.ELIGIBLE;
import static com.callqueue.dispatch.caller.EntryState.JOINING;
import static com.callqueue.dispatch.caller.EntryState.RETRYING;
import static com.callqueue.dispatch.caller.EntryState.WAITING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueCallerServiceTest {

    private final DispatchFixture f = new DispatchFixture();

    @Test
    void unanswered_ring_all_times_out_after_one_window() {
        var queue = f.queue("support", Map.of("strategy", "ringall", "timeout", "1"), "PJSIP/1001");
        var session = new FakeCallerSession("c1");

        var outcome = f.callers.enter(session, QueueRequest.of("support").withTimeout(Duration.ofMillis(1500)));

        assertEquals(QueueResult.TIMEOUT, outcome.result());
        assertEquals(EntryState.TIMED_OUT, outcome.finalState());
        assertEquals(List.of(JOINING, WAITING, ELIGIBLE, DIALING, RETRYING, EntryState.TIMED_OUT), outcome.path());

        var rna = f.events.records(QueueLogEvent.RINGNOANSWER);
        assertEquals(1, rna.size());
        assertEquals("1000", rna.get(0).info());
        assertEquals(1, f.events.records(QueueLogEvent.EXITWITHTIMEOUT).size());
        assertEquals("TIMEOUT", session.variables().get(QueueCallerService.QUEUESTATUS));

        assertEquals(0, queue.waiting().size());
        assertEquals(1, queue.statistics().snapshot().abandoned());
        var device = queue.members().find("PJSIP/1001").orElseThrow().device().snapshot();
        assertEquals(0, device.reserved());
        assertEquals(1, f.telephony.hungUp().size());
    }

    @Test
    void answered_call_is_bridged_and_accounted() {
        f.telephony.script("PJSIP/2001", Script.answerAfter(50)).agentHangsUp(true);
        var queue = f.queue("sales", Map.of("strategy", "ringall", "servicelevel", "30"), "PJSIP/2001");
        var session = new FakeCallerSession("c2");

        var outcome = f.callers.enter(session, QueueRequest.of("sales"));

        assertEquals(QueueResult.ANSWERED, outcome.result());
        assertEquals(EntryState.BRIDGED, outcome.finalState());
        assertEquals(List.of(JOINING, WAITING, ELIGIBLE, DIALING, EntryState.BRIDGED), outcome.path());
        assertEquals("PJSIP/2001", outcome.member());
        assertEquals("ANSWERED", session.variables().get(QueueCallerService.QUEUESTATUS));

        var connect = f.events.records(QueueLogEvent.CONNECT);
        assertEquals(1, connect.size());
        assertTrue(connect.get(0).info().startsWith("0|leg-1|"), connect.get(0).info());
        assertEquals(1, f.events.records(QueueLogEvent.COMPLETEAGENT).size());
        assertTrue(f.events.records(QueueLogEvent.COMPLETECALLER).isEmpty());

        var member = queue.members().find("PJSIP/2001").orElseThrow();
        assertEquals(1, member.calls());
        assertEquals("sales", member.lastQueue());
        assertFalse(member.inCall());
        var device = member.device().snapshot();
        assertEquals(0, device.reserved());
        assertEquals(0, device.active());

        var stats = queue.statistics().snapshot();
        assertEquals(1, stats.completed());
        assertEquals(1, stats.completedInServiceLevel());
        assertEquals(0, stats.abandoned());
        assertEquals(0, stats.waiting());
        assertEquals(1, f.telephony.bridged().size());
        assertEquals("sales", f.telephony.bridged().get(0).queueName());
    }

    @Test
    void caller_ending_the_bridge_is_logged_as_complete_caller() {
        f.telephony.script("PJSIP/2001", Script.answerAfter(10)).agentHangsUp(false);
        f.queue("sales", Map.of("strategy", "ringall"), "PJSIP/2001");

        var outcome = f.callers.enter(new FakeCallerSession("c3"), QueueRequest.of("sales"));

        assertEquals(QueueResult.ANSWERED, outcome.result());
        var complete = f.events.records(QueueLogEvent.COMPLETECALLER);
        assertEquals(1, complete.size());
        assertTrue(complete.get(0).info().endsWith("|1"), complete.get(0).info());
    }

    @Test
    void join_is_refused_when_the_band_excludes_every_member() {
        f.queue("support", Map.of("joinempty", "penalty"), "PJSIP/1001,1", "PJSIP/1002,10");
        var session = new FakeCallerSession("c4");

        var outcome = f.callers.enter(session, QueueRequest.of("support").withBand(PenaltyBand.of(5, 5)));

        assertEquals(QueueResult.JOINEMPTY, outcome.result());
        assertNull(outcome.finalState());
        assertEquals(List.of(JOINING), outcome.path());
        assertEquals("JOINEMPTY", session.variables().get(QueueCallerService.QUEUESTATUS));
        assertEquals(1, f.events.records(QueueLogEvent.JOINEMPTY).size());
        assertTrue(f.events.records(QueueLogEvent.ENTERQUEUE).isEmpty());
        assertTrue(f.telephony.originated().isEmpty());
    }

    @Test
    void join_is_refused_when_the_queue_is_full() throws Exception {
        var queue = f.queue("support", Map.of("maxlen", "1"), "PJSIP/1001");
        f.memberService.setPaused("support", "PJSIP/1001", true, "lunch");

        var first = new FakeCallerSession("c5");
        var waiting = f.enterAsync(first, QueueRequest.of("support").withTimeout(Duration.ofSeconds(5)));
        Await.until(() -> queue.waiting().size() == 1, "first caller to wait");

        var second = new FakeCallerSession("c6");
        var refused = f.callers.enter(second, QueueRequest.of("support"));
        assertEquals(QueueResult.FULL, refused.result());
        assertEquals("FULL", second.variables().get(QueueCallerService.QUEUESTATUS));
        assertEquals(1, f.events.records(QueueLogEvent.FULL).size());

        first.hangup();
        var outcome = waiting.get(5, TimeUnit.SECONDS);
        assertEquals(QueueResult.ABANDON, outcome.result());
        assertEquals(EntryState.ABANDONED, outcome.finalState());
        assertEquals(List.of(JOINING, WAITING, EntryState.ABANDONED), outcome.path());
        assertEquals(1, f.events.records(QueueLogEvent.ABANDON).size());
        assertEquals(1, f.events.notifications("QueueCallerAbandon").size());
        assertTrue(f.telephony.originated().isEmpty());
    }

    @Test
    void exit_digit_matching_the_exit_context_leaves_the_queue() throws Exception {
        var queue = f.queue("support", Map.of("context", "queue-exit"), "PJSIP/1001");
        f.memberService.setPaused("support", "PJSIP/1001", true, "lunch");
        var session = new FakeCallerSession("c7").withExtension("queue-exit", "5");

        var running = f.enterAsync(session, QueueRequest.of("support").withTimeout(Duration.ofSeconds(5)));
        Await.until(() -> queue.waiting().size() == 1, "caller to wait");
        session.press('5');

        var outcome = running.get(5, TimeUnit.SECONDS);
        assertEquals(QueueResult.EXITWITHKEY, outcome.result());
        assertEquals(EntryState.USER_EXITED, outcome.finalState());
        var exit = f.events.records(QueueLogEvent.EXITWITHKEY);
        assertEquals(1, exit.size());
        assertTrue(exit.get(0).info().startsWith("5|1|1|"), exit.get(0).info());
        assertEquals(0, queue.statistics().snapshot().abandoned());
        assertTrue(session.indications().contains("moh-stop"));
    }

    @Test
    void digits_outside_the_exit_context_are_ignored() throws Exception {
        var queue = f.queue("support", Map.of("context", "queue-exit"), "PJSIP/1001");
        f.memberService.setPaused("support", "PJSIP/1001", true, "lunch");
        var session = new FakeCallerSession("c8").withExtension("queue-exit", "5");

        var running = f.enterAsync(session, QueueRequest.of("support").withTimeout(Duration.ofMillis(600)));
        Await.until(() -> queue.waiting().size() == 1, "caller to wait");
        session.press('7');

        var outcome = running.get(5, TimeUnit.SECONDS);
        assertEquals(QueueResult.TIMEOUT, outcome.result());
        assertTrue(f.events.records(QueueLogEvent.EXITWITHKEY).isEmpty());
    }

    @Test
    void hangup_while_members_ring_abandons_and_releases_the_device() throws Exception {
        var queue = f.queue("support", Map.of("strategy", "ringall", "timeout", "0"), "PJSIP/1001");
        var session = new FakeCallerSession("c9");

        var running = f.enterAsync(session, QueueRequest.of("support"));
        Await.until(() -> !f.telephony.originated().isEmpty(), "member to be dialed");
        session.hangup();

        var outcome = running.get(5, TimeUnit.SECONDS);
        assertEquals(QueueResult.ABANDON, outcome.result());
        assertEquals(List.of(JOINING, WAITING, ELIGIBLE, DIALING, EntryState.ABANDONED), outcome.path());
        assertEquals(1, f.telephony.hungUp().size());
        assertEquals(0, queue.members().find("PJSIP/1001").orElseThrow().device().snapshot().reserved());
        assertEquals(1, queue.statistics().snapshot().abandoned());
        assertEquals(0, queue.waiting().size());
    }

    @Test
    void star_disconnects_the_caller_only_with_the_disconnect_option() throws Exception {
        f.queue("support", Map.of("strategy", "ringall", "timeout", "0"), "PJSIP/1001");
        var session = new FakeCallerSession("c10");

        var running = f.enterAsync(session, QueueRequest.of("support").withOptions(Set.of(QueueOption.CALLER_DISCONNECT)));
        Await.until(() -> !f.telephony.originated().isEmpty(), "member to be dialed");
        session.press('*');

        var outcome = running.get(5, TimeUnit.SECONDS);
        assertEquals(QueueResult.ABANDON, outcome.result());
        assertEquals("ABANDON", session.variables().get(QueueCallerService.QUEUESTATUS));
    }

    @Test
    void no_retry_leaves_after_one_pass_over_the_roster() {
        f.telephony.script("PJSIP/1001", Script.signalAfter(LegSignalType.BUSY, 10));
        f.queue("support", Map.of("strategy", "linear", "retry", "0"), "PJSIP/1001");

        var outcome = f.callers.enter(new FakeCallerSession("c11"),
                QueueRequest.of("support").withOptions(Set.of(QueueOption.NO_RETRY)).withTimeout(Duration.ofSeconds(5)));

        assertEquals(QueueResult.TIMEOUT, outcome.result());
        assertEquals(List.of(JOINING, WAITING, ELIGIBLE, DIALING, RETRYING, EntryState.TIMED_OUT), outcome.path());
        assertEquals(1, f.telephony.originated().size());
    }

    @Test
    void zero_retry_pauses_between_cycles_instead_of_redialing_at_once() {
        f.telephony.script("PJSIP/1001", Script.refuse());
        var queue = f.queue("support", Map.of("strategy", "ringall", "retry", "0"), "PJSIP/1001");

        var outcome = f.callers.enter(new FakeCallerSession("c14"),
                QueueRequest.of("support").withTimeout(Duration.ofMillis(600)));

        assertEquals(5, queue.settings().retrySeconds());
        assertEquals(QueueResult.TIMEOUT, outcome.result());
        assertEquals(List.of(JOINING, WAITING, ELIGIBLE, DIALING, RETRYING, EntryState.TIMED_OUT), outcome.path());
        assertEquals(1, f.telephony.originated().size());
    }

    @Test
    void caller_whose_band_excludes_every_member_keeps_waiting_without_dialing() {
        var queue = f.queue("support", Map.of("retry", "1"), "PJSIP/1001,1", "PJSIP/1002,10");

        var outcome = f.callers.enter(new FakeCallerSession("c15"),
                QueueRequest.of("support").withBand(PenaltyBand.of(5, 5)).withTimeout(Duration.ofMillis(1500)));

        assertEquals(QueueResult.TIMEOUT, outcome.result());
        assertEquals(List.of(JOINING, WAITING, EntryState.TIMED_OUT), outcome.path());
        assertFalse(outcome.path().contains(DIALING));
        assertTrue(f.telephony.originated().isEmpty());
        assertEquals(0, queue.waiting().size());
    }

    @Test
    void leave_when_empty_ends_the_wait_once_every_member_is_paused() throws Exception {
        var queue = f.queue("support", Map.of("leavewhenempty", "paused"), "PJSIP/1001");
        f.memberService.setPaused("support", "PJSIP/1001", true, "lunch");

        var outcome = f.callers.enter(new FakeCallerSession("c12"), QueueRequest.of("support").withTimeout(Duration.ofSeconds(5)));

        assertEquals(QueueResult.LEAVEEMPTY, outcome.result());
        assertEquals(EntryState.LEFT_EMPTY, outcome.finalState());
        assertEquals(1, f.events.records(QueueLogEvent.EXITEMPTY).size());
        assertEquals(0, queue.waiting().size());
    }

    @Test
    void unknown_queue_is_rejected() {
        assertThrows(QueueNotFoundException.class,
                () -> f.callers.enter(new FakeCallerSession("c13"), QueueRequest.of("nope")));
    }
}
