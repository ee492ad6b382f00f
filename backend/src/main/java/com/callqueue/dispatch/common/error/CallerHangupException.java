package com.callqueue.dispatch.common.error;

/**
 * Raised by a caller session once the caller leg is gone.
 */
public class CallerHangupException extends RuntimeException {

    public CallerHangupException(String callId) {
        super("caller_hangup call_id=" + callId);
    }
}
