package com.callqueue.dispatch.ring;

/**
 * Dialing operations the answer multiplexer calls back into while it waits.
 */
public interface CycleDialer {

    /**
     * Dials the next best pending attempt(s).
     *
     * @return true when at least one leg is ringing afterwards
     */
    boolean ringOne(RingCycle cycle);

    /**
     * Replaces the attempt's leg with one towards {@code target}.
     */
    void forward(RingCycle cycle, CallAttempt attempt, String target);

    /**
     * Hangs up the attempt's leg and gives back its device reservation.
     */
    void hangupAttempt(CallAttempt attempt);
}
