package com.callqueue.dispatch.queue;

public record QueueSounds(
        String youAreNext,
        String thereAre,
        String callsWaiting,
        String holdTime,
        String minute,
        String minutes,
        String seconds,
        String thankYou,
        String quantity1,
        String quantity2
) {

    public static QueueSounds defaults() {
        return new QueueSounds(
                "queue-youarenext",
                "queue-thereare",
                "queue-callswaiting",
                "queue-holdtime",
                "queue-minute",
                "queue-minutes",
                "queue-seconds",
                "queue-thankyou",
                "queue-quantity1",
                "queue-quantity2"
        );
    }
}
