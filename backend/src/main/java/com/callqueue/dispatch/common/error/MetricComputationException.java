package com.callqueue.dispatch.common.error;

public class MetricComputationException extends RuntimeException {

    public MetricComputationException(String message) {
        super(message);
    }
}
