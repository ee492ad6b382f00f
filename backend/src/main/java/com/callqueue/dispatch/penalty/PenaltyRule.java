package com.callqueue.dispatch.penalty;

/**
 * One step of a penalty rule list. Relative values are added to the caller's current bound,
 * absolute values replace it.
 */
public record PenaltyRule(
        int timeSeconds,
        int maxValue,
        boolean maxRelative,
        int minValue,
        boolean minRelative,
        int raiseValue,
        boolean raiseRelative
) {
}
