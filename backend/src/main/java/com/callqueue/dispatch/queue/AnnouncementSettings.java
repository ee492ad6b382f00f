package com.callqueue.dispatch.queue;

import java.util.List;

public record AnnouncementSettings(
        int frequencySeconds,
        int minFrequencySeconds,
        int periodicFrequencySeconds,
        List<String> periodicAnnounce,
        boolean randomPeriodic,
        boolean relativePeriodic,
        AnnouncePositionPolicy position,
        int positionLimit,
        HoldtimePolicy holdtime,
        int roundSeconds,
        QueueSounds sounds
) {
    public AnnouncementSettings {
        periodicAnnounce = periodicAnnounce == null ? List.of() : List.copyOf(periodicAnnounce);
    }
}
