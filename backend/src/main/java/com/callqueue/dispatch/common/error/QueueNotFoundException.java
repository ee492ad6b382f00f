package com.callqueue.dispatch.common.error;

public class QueueNotFoundException extends IllegalArgumentException {

    private final String queueName;

    public QueueNotFoundException(String queueName) {
        super("no_such_queue");
        this.queueName = queueName;
    }

    public String queueName() {
        return queueName;
    }
}
