package com.callqueue.dispatch.member;

import com.callqueue.dispatch.common.config.ConfigValues;
import com.callqueue.dispatch.common.error.InvalidQueueConfigException;

/**
 * Parses a static member line: {@code interface[,penalty[,membername[,state_interface[,ringinuse[,wrapuptime]]]]]}.
 */
public final class MemberLineParser {

    private MemberLineParser() {
    }

    public static MemberConfig parse(String line) {
        if (line == null || line.isBlank()) throw new InvalidQueueConfigException("member_line_empty");
        var parts = line.split(",", -1);
        var iface = parts[0].trim();
        if (iface.isEmpty()) throw new InvalidQueueConfigException("member_interface_required");

        var penalty = parts.length > 1 ? parseInt(parts[1], "member_penalty_invalid") : 0;
        if (penalty < 0) throw new InvalidQueueConfigException("member_penalty_invalid");
        var name = parts.length > 2 ? parts[2].trim() : null;
        var state = parts.length > 3 ? parts[3].trim() : null;
        Boolean ringInUse = null;
        if (parts.length > 4 && !parts[4].isBlank()) {
            ringInUse = ConfigValues.parseBoolean(parts[4], null);
        }
        var wrapup = parts.length > 5 ? parseInt(parts[5], "member_wrapup_invalid") : 0;
        return new MemberConfig(iface, name, state, penalty, false, null, wrapup, ringInUse, null);
    }

    private static int parseInt(String raw, String error) {
        if (raw == null || raw.isBlank()) return 0;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueueConfigException(error);
        }
    }
}
