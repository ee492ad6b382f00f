package com.callqueue.dispatch.penalty;

import com.callqueue.dispatch.common.error.InvalidQueueConfigException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PenaltyRuleParserTest {

    @Test
    void parses_absolute_and_relative_values() {
        var rule = PenaltyRuleParser.parseLine("60,+2,5,-1");

        assertEquals(60, rule.timeSeconds());
        assertEquals(2, rule.maxValue());
        assertTrue(rule.maxRelative());
        assertEquals(5, rule.minValue());
        assertFalse(rule.minRelative());
        assertEquals(-1, rule.raiseValue());
        assertTrue(rule.raiseRelative());
    }

    @Test
    void missing_min_and_raise_leave_them_unchanged() {
        var rule = PenaltyRuleParser.parseLine("30,10");

        assertFalse(rule.maxRelative());
        assertEquals(0, rule.minValue());
        assertTrue(rule.minRelative());
        assertTrue(rule.raiseRelative());
    }

    @Test
    void rejects_malformed_lines() {
        assertThrows(InvalidQueueConfigException.class, () -> PenaltyRuleParser.parseLine("30"));
        assertThrows(InvalidQueueConfigException.class, () -> PenaltyRuleParser.parseLine("soon,1"));
        assertThrows(InvalidQueueConfigException.class, () -> PenaltyRuleParser.parseLine("-5,1"));
        assertThrows(InvalidQueueConfigException.class, () -> PenaltyRuleParser.parseLine("30,x"));
        assertThrows(InvalidQueueConfigException.class, () -> PenaltyRuleParser.parseLine(" "));
    }

    @Test
    void list_is_sorted_skips_bad_lines_and_keeps_the_last_duplicate() {
        var list = PenaltyRuleParser.parse("escalate", List.of("120,10", "bogus", "30,+1", "30,+3", "60,+2,1"));

        assertEquals("escalate", list.name());
        assertEquals(List.of(30, 60, 120), list.rules().stream().map(PenaltyRule::timeSeconds).toList());
        assertEquals(3, list.rules().get(0).maxValue());
    }
}
