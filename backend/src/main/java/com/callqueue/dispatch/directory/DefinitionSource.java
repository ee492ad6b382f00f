package com.callqueue.dispatch.directory;

public enum DefinitionSource {
    STATIC,
    REALTIME
}
