package com.callqueue.dispatch.telephony;

import java.util.Map;

/**
 * Caller identity and variables copied onto every leg dialed on the caller's behalf.
 */
public record CallerContext(
        String callId,
        String callerNumber,
        String callerName,
        Map<String, String> variables
) {
    public CallerContext {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }
}
