package com.callqueue.dispatch.common.error;

public class TelephonyException extends Exception {

    public TelephonyException(String message) {
        super(message);
    }

    public TelephonyException(String message, Throwable cause) {
        super(message, cause);
    }
}
