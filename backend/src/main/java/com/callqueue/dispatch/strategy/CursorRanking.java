package com.callqueue.dispatch.strategy;

import com.callqueue.dispatch.queue.RoundRobinCursor;

final class CursorRanking {

    private CursorRanking() {
    }

    /**
     * Members before the cursor rank after every member at or past it.
     */
    static long rank(RoundRobinCursor cursor, int position) {
        var at = cursor.position();
        if (position < at) return 1000L + position;
        if (position > at) cursor.markWrapped();
        return position;
    }
}
