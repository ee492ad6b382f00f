package com.callqueue.dispatch.queue;

import java.util.Locale;

public enum Strategy {
    RINGALL("ringall"),
    LEASTRECENT("leastrecent"),
    FEWESTCALLS("fewestcalls"),
    RANDOM("random"),
    RRMEMORY("rrmemory"),
    RRORDERED("rrordered"),
    LINEAR("linear"),
    WRANDOM("wrandom");

    private final String key;

    Strategy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isRoundRobin() {
        return this == RRMEMORY || this == RRORDERED;
    }

    /**
     * @return null when the name is not a known strategy
     */
    public static Strategy parse(String raw) {
        if (raw == null) return null;
        var key = raw.trim().toLowerCase(Locale.ROOT);
        if ("roundrobin".equals(key)) return RRMEMORY;
        for (var s : values()) {
            if (s.key.equals(key)) return s;
        }
        return null;
    }
}
