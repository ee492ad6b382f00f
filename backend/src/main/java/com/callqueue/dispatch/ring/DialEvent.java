package com.callqueue.dispatch.ring;

import com.callqueue.dispatch.session.CallerSignal;
import com.callqueue.dispatch.telephony.LegSignal;

/**
 * Either a signal from one dialed leg or one from the caller.
 */
record DialEvent(CallAttempt attempt, LegSignal legSignal, CallerSignal callerSignal) {

    static DialEvent leg(CallAttempt attempt, LegSignal signal) {
        return new DialEvent(attempt, signal, null);
    }

    static DialEvent caller(CallerSignal signal) {
        return new DialEvent(null, null, signal);
    }

    boolean fromCaller() {
        return callerSignal != null;
    }

    /**
     * Signals of a leg the attempt no longer owns, e.g. the one replaced by a forward.
     */
    boolean isStale() {
        if (fromCaller()) return false;
        return attempt == null || !attempt.stillGoing() || attempt.leg() == null
                || legSignal == null || !attempt.leg().equals(legSignal.leg());
    }
}
