package com.callqueue.dispatch.ring;

/**
 * How one ring cycle ended.
 *
 * @param peer       the answering attempt, set only for {@link Exit#ANSWERED}
 * @param ringTimeMs time the peer rang before answering
 */
public record RingResult(Exit exit, CallAttempt peer, char digit, long ringTimeMs) {

    public enum Exit {
        ANSWERED,
        NO_ANSWER,
        CALLER_HANGUP,
        CALLER_DISCONNECT,
        EXIT_KEY
    }

    public static RingResult answered(CallAttempt peer, long ringTimeMs) {
        return new RingResult(Exit.ANSWERED, peer, (char) 0, ringTimeMs);
    }

    public static RingResult of(Exit exit) {
        return new RingResult(exit, null, (char) 0, 0);
    }

    public static RingResult exitKey(char digit) {
        return new RingResult(Exit.EXIT_KEY, null, digit, 0);
    }
}
