package com.callqueue.dispatch.directory;

import com.callqueue.dispatch.bootstrap.CallQueueApplication;
import com.callqueue.dispatch.directory.repo.RealtimeQueueRepository;
import com.callqueue.dispatch.member.Member;
import com.callqueue.dispatch.member.MemberConfig;
import com.callqueue.dispatch.member.MemberOpResult;
import com.callqueue.dispatch.member.service.MemberService;
import com.callqueue.dispatch.penalty.RuleRegistry;
import com.callqueue.dispatch.queue.QueueRegistry;
import com.callqueue.dispatch.queue.Strategy;
import com.callqueue.dispatch.queue.service.QueueConfigurationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(classes = CallQueueApplication.class)
@ActiveProfiles("dev")
class DirectoryQueueSourceTest {

    @Autowired
    DirectoryQueueSource directory;

    @Autowired
    QueueRegistry queueRegistry;

    @Autowired
    RuleRegistry ruleRegistry;

    @Autowired
    MemberService memberService;

    @Autowired
    QueueConfigurationService configuration;

    @Autowired
    RealtimeQueueRepository realtimeQueueRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void static_queues_and_rules_are_loaded_at_startup() {
        var support = queueRegistry.require("support");
        assertEquals(Strategy.RRMEMORY, support.settings().strategy());
        assertEquals(10, support.settings().wrapupSeconds());
        assertEquals("escalate", support.settings().defaultRule());
        assertEquals(List.of("PJSIP/1001", "PJSIP/1002", "PJSIP/1003"),
                support.members().snapshot().stream().map(Member::iface).toList());
        assertFalse(support.members().find("PJSIP/1003").orElseThrow().ringInUse());

        var sales = queueRegistry.require("sales");
        assertEquals(10, sales.settings().weight());
        assertEquals("sales", sales.settings().musicClass());
        assertTrue(queueRegistry.anyWeighted());

        assertEquals(3, ruleRegistry.rulesFor("escalate").size());
    }

    @Test
    void realtime_queue_appears_after_reload() {
        realtimeQueueRepository.upsertParam("billing", "strategy", "linear");
        realtimeQueueRepository.upsertParam("billing", "strategy", "fewestcalls");
        jdbcTemplate.update("""
                insert into queue_member(uniqueid, queue_name, interface, membername, penalty, paused)
                values (?, ?, ?, ?, ?, ?)
                """, "rt-billing-1", "billing", "PJSIP/4001", "Erin", 2, false);

        directory.triggerReload();

        var billing = queueRegistry.require("billing");
        assertEquals(Strategy.FEWESTCALLS, billing.settings().strategy());
        assertTrue(configuration.isRealtime("billing"));
        var erin = billing.members().find("PJSIP/4001").orElseThrow();
        assertEquals("Erin", erin.memberName());
        assertEquals(2, erin.penalty());

        memberService.setPaused("billing", "PJSIP/4001", true, "training");
        var row = jdbcTemplate.queryForMap("select paused, reason_paused from queue_member where uniqueid = ?", "rt-billing-1");
        assertEquals(Boolean.TRUE, row.get("paused"));
        assertEquals("training", row.get("reason_paused"));
    }

    @Test
    void dynamic_roster_is_written_and_cleared() {
        assertEquals(MemberOpResult.OK, memberService.addMember("sales", MemberConfig.of("PJSIP/3001").withPenalty(4)));

        var saved = directory.loadPersistedMembers("sales");
        assertEquals(1, saved.size());
        assertEquals("PJSIP/3001", saved.get(0).iface());
        assertEquals(4, saved.get(0).penalty());

        assertEquals(MemberOpResult.OK, memberService.removeMember("sales", "PJSIP/3001"));
        assertTrue(directory.loadPersistedMembers("sales").isEmpty());
    }
}
