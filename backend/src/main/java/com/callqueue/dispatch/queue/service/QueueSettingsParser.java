package com.callqueue.dispatch.queue.service;

import com.callqueue.dispatch.common.config.ConfigValues;
import com.callqueue.dispatch.queue.AnnouncePositionPolicy;
import com.callqueue.dispatch.queue.AnnouncementSettings;
import com.callqueue.dispatch.queue.AutopausePolicy;
import com.callqueue.dispatch.queue.EmptyCondition;
import com.callqueue.dispatch.queue.HoldtimePolicy;
import com.callqueue.dispatch.queue.QueueSettings;
import com.callqueue.dispatch.queue.QueueSounds;
import com.callqueue.dispatch.queue.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link QueueSettings} from a flat parameter map. A bad value is logged and replaced by its
 * default; it never rejects the whole queue.
 */
public final class QueueSettingsParser {

    private static final Logger log = LoggerFactory.getLogger(QueueSettingsParser.class);

    private static final Set<String> IGNORED = Set.of("name", "queue-name", "member");

    private QueueSettingsParser() {
    }

    public static QueueSettings defaults(String name) {
        return parse(name, Map.of());
    }

    public static QueueSettings parse(String name, Map<String, String> raw) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("queue_name_required");
        var p = new Params(name, normalize(raw));

        var strategyRaw = p.string("strategy", "ringall");
        var strategy = Strategy.parse(strategyRaw);
        if (strategy == null) {
            log.warn("queue_strategy_unknown queue={} strategy={} fallback=ringall", name, strategyRaw);
            strategy = Strategy.RINGALL;
        }

        var d = QueueSounds.defaults();
        var sounds = new QueueSounds(
                p.string("queue-youarenext", d.youAreNext()),
                p.string("queue-thereare", d.thereAre()),
                p.string("queue-callswaiting", d.callsWaiting()),
                p.string("queue-holdtime", d.holdTime()),
                p.string("queue-minute", d.minute()),
                p.string("queue-minutes", d.minutes()),
                p.string("queue-seconds", d.seconds()),
                p.string("queue-thankyou", d.thankYou()),
                p.string("queue-quantity1", d.quantity1()),
                p.string("queue-quantity2", d.quantity2())
        );

        var announcements = new AnnouncementSettings(
                p.nonNegative("announce-frequency", 0),
                p.nonNegative("min-announce-frequency", 15),
                p.nonNegative("periodic-announce-frequency", 0),
                p.list("periodic-announce"),
                p.bool("random-periodic-announce", false),
                p.bool("relative-periodic-announce", false),
                p.announcePosition(),
                p.nonNegative("announce-position-limit", 5),
                p.holdtime(),
                p.roundSeconds(),
                sounds
        );

        var settings = new QueueSettings(
                name,
                strategy,
                p.nonNegative("timeout", 15),
                p.positive("retry", 5),
                p.nonNegative("wrapuptime", 0),
                p.nonNegative("maxlen", 0),
                p.nonNegative("weight", 0),
                p.nonNegative("penaltymemberslimit", 0),
                p.emptyConditions("joinempty", true),
                p.emptyConditions("leavewhenempty", false),
                p.bool("autofill", true),
                p.autopause(),
                p.nonNegative("autopausedelay", 0),
                p.bool("autopausebusy", false),
                p.bool("autopauseunavail", false),
                p.bool("ringinuse", true),
                p.bool("timeoutrestart", false),
                p.nonNegative("servicelevel", 0),
                p.string("context", null),
                p.string("defaultrule", null),
                p.string("musicclass", p.string("musiconhold", "default")),
                p.string("announce", null),
                announcements
        );
        p.warnUnused();
        return settings;
    }

    /**
     * Parses a join-empty or leave-when-empty value: a yes/no/strict/loose keyword or a comma list of conditions.
     */
    public static Set<EmptyCondition> parseEmptyConditions(String raw, boolean joinEmpty) {
        var result = EnumSet.noneOf(EmptyCondition.class);
        if (raw == null || raw.isBlank()) return result;
        var value = raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "loose" -> {
                result.add(EmptyCondition.PENALTY);
                result.add(EmptyCondition.INVALID);
                return result;
            }
            case "strict" -> {
                result.add(EmptyCondition.PENALTY);
                result.add(EmptyCondition.INVALID);
                result.add(EmptyCondition.PAUSED);
                result.add(EmptyCondition.UNAVAILABLE);
                return result;
            }
            default -> {
            }
        }
        var flag = ConfigValues.parseBoolean(value, null);
        if (flag != null) {
            // joinempty=no and leavewhenempty=yes both mean "treat an unusable roster as empty"
            if (flag != joinEmpty) {
                result.add(EmptyCondition.PENALTY);
                result.add(EmptyCondition.INVALID);
                result.add(EmptyCondition.PAUSED);
            }
            return result;
        }
        for (var token : value.split(",")) {
            var t = token.trim();
            if (t.isEmpty()) continue;
            try {
                result.add(EmptyCondition.valueOf(t.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("queue_empty_condition_unknown value={}", t);
            }
        }
        return result;
    }

    private static Map<String, String> normalize(Map<String, String> raw) {
        var out = new HashMap<String, String>();
        if (raw == null) return out;
        for (var e : raw.entrySet()) {
            if (e.getKey() == null) continue;
            var key = e.getKey().trim().toLowerCase(Locale.ROOT).replace('_', '-');
            out.put(key, e.getValue());
        }
        return out;
    }

    private static final class Params {
        private final String queue;
        private final Map<String, String> values;
        private final Set<String> used = new HashSet<>();

        private Params(String queue, Map<String, String> values) {
            this.queue = queue;
            this.values = values;
        }

        private String raw(String key) {
            used.add(key);
            var v = values.get(key);
            return v == null || v.isBlank() ? null : v.trim();
        }

        String string(String key, String fallback) {
            var v = raw(key);
            return v == null ? fallback : v;
        }

        boolean bool(String key, boolean fallback) {
            var v = raw(key);
            if (v == null) return fallback;
            var parsed = ConfigValues.parseBoolean(v, null);
            if (parsed == null) {
                log.warn("queue_param_invalid queue={} param={} value={}", queue, key, v);
                return fallback;
            }
            return parsed;
        }

        int nonNegative(String key, int fallback) {
            var v = raw(key);
            if (v == null) return fallback;
            try {
                var n = ConfigValues.parseInt(v);
                if (n >= 0) return n;
            } catch (NumberFormatException ignored) {
                // reported below
            }
            log.warn("queue_param_invalid queue={} param={} value={}", queue, key, v);
            return fallback;
        }

        int positive(String key, int fallback) {
            var n = nonNegative(key, fallback);
            if (n > 0) return n;
            log.warn("queue_param_invalid queue={} param={} value={}", queue, key, n);
            return fallback;
        }

        List<String> list(String key) {
            var v = raw(key);
            var out = new ArrayList<String>();
            if (v == null) return out;
            for (var s : v.split("[,|]")) {
                if (!s.isBlank()) out.add(s.trim());
            }
            return out;
        }

        Set<EmptyCondition> emptyConditions(String key, boolean joinEmpty) {
            return parseEmptyConditions(raw(key), joinEmpty);
        }

        AutopausePolicy autopause() {
            var v = raw("autopause");
            if (v == null) return AutopausePolicy.OFF;
            if ("all".equalsIgnoreCase(v)) return AutopausePolicy.ALL;
            var flag = ConfigValues.parseBoolean(v, null);
            if (flag == null) {
                log.warn("queue_param_invalid queue={} param=autopause value={}", queue, v);
                return AutopausePolicy.OFF;
            }
            return flag ? AutopausePolicy.ON : AutopausePolicy.OFF;
        }

        AnnouncePositionPolicy announcePosition() {
            var v = raw("announce-position");
            if (v == null) return AnnouncePositionPolicy.YES;
            var key = v.toLowerCase(Locale.ROOT);
            if ("limit".equals(key)) return AnnouncePositionPolicy.LIMIT;
            if ("more".equals(key)) return AnnouncePositionPolicy.MORE;
            return ConfigValues.isFalse(key) ? AnnouncePositionPolicy.NO : AnnouncePositionPolicy.YES;
        }

        HoldtimePolicy holdtime() {
            var v = raw("announce-holdtime");
            if (v == null) return HoldtimePolicy.NO;
            if ("once".equalsIgnoreCase(v)) return HoldtimePolicy.ONCE;
            return ConfigValues.isTrue(v) ? HoldtimePolicy.YES : HoldtimePolicy.NO;
        }

        int roundSeconds() {
            var n = nonNegative("announce-round-seconds", 0);
            // only divisors of a minute make sense for rounding
            if (n > 0 && (n > 60 || 60 % n != 0)) {
                log.warn("queue_param_invalid queue={} param=announce-round-seconds value={}", queue, n);
                return 0;
            }
            return n;
        }

        void warnUnused() {
            for (var key : values.keySet()) {
                if (!used.contains(key) && !IGNORED.contains(key)) {
                    log.warn("queue_param_unknown queue={} param={}", queue, key);
                }
            }
        }
    }
}
