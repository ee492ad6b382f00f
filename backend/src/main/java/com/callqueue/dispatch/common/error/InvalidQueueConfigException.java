package com.callqueue.dispatch.common.error;

/**
 * A single configuration record that cannot be used. Callers log it and skip the record.
 */
public class InvalidQueueConfigException extends IllegalArgumentException {

    public InvalidQueueConfigException(String message) {
        super(message);
    }
}
