package com.callqueue.dispatch.caller.service;

import com.callqueue.dispatch.caller.ExitDigitMatcher;
import com.callqueue.dispatch.caller.QueueEntry;
import com.callqueue.dispatch.caller.QueueOption;
import com.callqueue.dispatch.queue.AnnouncePositionPolicy;
import com.callqueue.dispatch.queue.HoldtimePolicy;
import com.callqueue.dispatch.session.CallerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Position, hold-time and periodic announcements for waiting callers. Each method returns the exit digit
 * when the caller pressed one that leaves the queue, otherwise {@link CallerSession#NO_DIGIT}.
 */
@Component
public class AnnouncementService {

    private static final Logger log = LoggerFactory.getLogger(AnnouncementService.class);

    private final Clock clock;

    public AnnouncementService(Clock clock) {
        this.clock = clock;
    }

    public void playJoinAnnouncement(QueueEntry entry) {
        var sound = entry.queue().settings().joinAnnouncement();
        if (sound == null || sound.isBlank()) return;
        entry.session().playPrompt(sound);
    }

    public char sayPosition(QueueEntry entry) {
        var settings = entry.queue().settings();
        var ann = settings.announcements();
        var now = clock.instant();
        var last = entry.lastPositionAnnounce();
        var position = entry.position();

        if (last != null) {
            var since = Duration.between(last, now).toSeconds();
            if (since < ann.minFrequencySeconds()) return CallerSession.NO_DIGIT;
            if (entry.lastPositionSaid() == position && since < ann.frequencySeconds()) return CallerSession.NO_DIGIT;
        }

        var session = entry.session();
        pauseHold(entry);

        var sounds = ann.sounds();
        var policy = ann.position();
        var sayThanks = false;
        var digit = CallerSession.NO_DIGIT;
        var skipHoldtime = false;

        if (policy == AnnouncePositionPolicy.YES || policy == AnnouncePositionPolicy.MORE
                || (policy == AnnouncePositionPolicy.LIMIT && position <= ann.positionLimit())) {
            sayThanks = true;
            if (position == 1) {
                digit = session.playPrompt(sounds.youAreNext());
                skipHoldtime = true;
            } else {
                var moreThan = policy == AnnouncePositionPolicy.MORE && position > ann.positionLimit();
                digit = session.playPrompt(moreThan ? sounds.quantity1() : sounds.thereAre());
                if (digit == CallerSession.NO_DIGIT) {
                    digit = session.sayNumber(moreThan ? ann.positionLimit() : position);
                }
                if (digit == CallerSession.NO_DIGIT) {
                    digit = session.playPrompt(moreThan ? sounds.quantity2() : sounds.callsWaiting());
                }
            }
        }

        if (digit == CallerSession.NO_DIGIT && !skipHoldtime) {
            var waited = Duration.between(entry.joinedAt(), now).toSeconds();
            var estimate = Math.abs(entry.queue().statistics().holdTime() + 30 - waited);
            var minutes = estimate / 60;
            var seconds = ann.roundSeconds() > 0
                    ? ((estimate - 60 * minutes) / ann.roundSeconds()) * ann.roundSeconds()
                    : 0;
            var holdtime = ann.holdtime();
            var allowed = holdtime == HoldtimePolicy.YES || (holdtime == HoldtimePolicy.ONCE && last == null);
            if (minutes + seconds > 0 && allowed) {
                sayThanks = true;
                digit = session.playPrompt(sounds.holdTime());
                if (digit == CallerSession.NO_DIGIT && minutes >= 1) {
                    digit = session.sayNumber((int) minutes);
                    if (digit == CallerSession.NO_DIGIT) {
                        digit = session.playPrompt(minutes == 1 ? sounds.minute() : sounds.minutes());
                    }
                }
                if (digit == CallerSession.NO_DIGIT && seconds >= 1) {
                    digit = session.sayNumber((int) seconds);
                    if (digit == CallerSession.NO_DIGIT) {
                        digit = session.playPrompt(sounds.seconds());
                    }
                }
            }
        }

        if (digit == CallerSession.NO_DIGIT && sayThanks) {
            digit = session.playPrompt(sounds.thankYou());
        }

        var exit = exitDigit(entry, digit);
        entry.recordPositionAnnounce(now, position);
        log.debug("position_announced queue={} call={} position={}", entry.queue().name(), entry.callId(), position);
        if (exit == CallerSession.NO_DIGIT) resumeHold(entry);
        return exit;
    }

    public char sayPeriodic(QueueEntry entry) {
        var ann = entry.queue().settings().announcements();
        var sounds = ann.periodicAnnounce();
        if (ann.periodicFrequencySeconds() <= 0 || sounds.isEmpty()) return CallerSession.NO_DIGIT;

        var now = clock.instant();
        if (Duration.between(entry.lastPeriodicAnnounce(), now).toSeconds() < ann.periodicFrequencySeconds()) {
            return CallerSession.NO_DIGIT;
        }

        pauseHold(entry);
        int index;
        if (ann.randomPeriodic()) {
            index = ThreadLocalRandom.current().nextInt(sounds.size());
        } else {
            index = entry.nextPeriodicIndex();
            if (index >= sounds.size() || sounds.get(index) == null || sounds.get(index).isBlank()) index = 0;
        }
        var exit = exitDigit(entry, entry.session().playPrompt(sounds.get(index)));
        if (exit == CallerSession.NO_DIGIT) resumeHold(entry);

        var at = ann.relativePeriodic() ? clock.instant() : now;
        entry.recordPeriodicAnnounce(at, ann.randomPeriodic() ? index : index + 1);
        return exit;
    }

    private char exitDigit(QueueEntry entry, char digit) {
        if (digit == CallerSession.NO_DIGIT) return digit;
        return ExitDigitMatcher.validExit(entry, digit) ? digit : CallerSession.NO_DIGIT;
    }

    private void pauseHold(QueueEntry entry) {
        if (entry.has(QueueOption.RING_INSTEAD_OF_MOH)) {
            entry.session().stopIndications();
        } else {
            entry.session().stopMusicOnHold();
        }
    }

    void resumeHold(QueueEntry entry) {
        if (entry.has(QueueOption.RING_INSTEAD_OF_MOH)) {
            entry.session().indicateRinging();
        } else {
            entry.session().startMusicOnHold(entry.queue().settings().musicClass());
        }
    }
}
