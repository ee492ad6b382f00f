package com.callqueue.dispatch.caller;

/**
 * Matches the digits a waiting caller presses against the queue's exit context.
 */
public final class ExitDigitMatcher {

    private ExitDigitMatcher() {
    }

    /**
     * Appends {@code digit} to the caller's buffer. A buffer that can no longer match any extension is
     * cleared. Returns true once the buffer names an existing extension and the caller has been moved there.
     */
    public static boolean validExit(QueueEntry entry, char digit) {
        var context = entry.queue().settings().exitContext();
        if (context == null || context.isBlank()) return false;

        var digits = entry.appendDigit(digit);
        if (digits == null) return false;

        var session = entry.session();
        if (!session.canMatchExtension(context, digits)) {
            entry.resetDigits();
            return false;
        }
        return session.gotoIfExists(context, digits);
    }
}
