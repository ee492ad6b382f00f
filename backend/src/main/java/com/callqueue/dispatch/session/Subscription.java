package com.callqueue.dispatch.session;

public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
