package io.buddy4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the schedule specs of the maintenance passes.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Human-readable intervals: "15 minutes", "1 hour", "1 day 6 hours"</li>
 *   <li>Compact intervals: "90s", "30m", "6h", "3d", "2w"</li>
 *   <li>Plain seconds: "900"</li>
 *   <li>Cron expressions, 5 or 6 fields: e.g. "0 *&#47;15 * * * *" (evaluated in the sweep time zone)</li>
 * </ul>
 */
public final class IntervalParser {

    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*([smhdw])$");

    private static final Map<String, Duration> UNITS = Map.of(
            "second", Duration.ofSeconds(1),
            "minute", Duration.ofMinutes(1),
            "hour", Duration.ofHours(1),
            "day", Duration.ofDays(1),
            "week", Duration.ofDays(7),
            "month", Duration.ofDays(30)
    );

    private IntervalParser() {
    }

    /**
     * Computes when a pass runs next.
     *
     * @param spec schedule spec (interval or cron)
     * @param zone zone used for cron evaluation
     * @param from the instant the previous run finished (or the start time)
     */
    public static Instant nextRun(String spec, ZoneId zone, Instant from) {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(from, "from must not be null");
        String s = requireSpec(spec);
        if (looksLikeCron(s)) {
            return nextCronTime(normalizeCron(s), zone, from);
        }
        return from.plus(parseHumanDuration(s));
    }

    /**
     * Fails fast on a spec that is neither a valid cron expression nor a positive interval.
     */
    public static void validate(String spec) {
        String s = requireSpec(spec);
        if (looksLikeCron(s)) {
            return;
        }
        if (parseHumanDuration(s).isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + spec);
        }
    }

    /**
     * Normalize cron expressions:
     * - Accepts 6-field Spring cron.
     * - Accepts 5-field cron by prepending seconds "0".
     * Quartz wants "?" in one of the day fields, which is filled in when both are "*".
     */
    public static String normalizeCron(String spec) {
        String s = requireSpec(spec);
        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    public static boolean looksLikeCron(String spec) {
        if (spec == null || spec.trim().split("\\s+").length < 5) {
            return false;
        }
        return CronExpression.isValidExpression(normalizeCron(spec));
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds = parseCount(s, input);
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            long n = parseCount(compact.group(1), input);
            return switch (compact.group(2).charAt(0)) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                default -> Duration.ofDays(7L * n);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }
        Set<String> seen = new HashSet<>();
        Duration total = Duration.ZERO;
        for (int i = 0; i < parts.length; i += 2) {
            long n = parseCount(parts[i], input);
            String unit = parts[i + 1].endsWith("s") ? parts[i + 1].substring(0, parts[i + 1].length() - 1) : parts[i + 1];
            Duration unitLength = UNITS.get(unit);
            if (unitLength == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit);
            }
            total = total.plus(unitLength.multipliedBy(n));
        }
        return total;
    }

    private static Instant nextCronTime(String cron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));
        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return next.toInstant();
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dow = dayOfWeek;
        if ("*".equals(dayOfMonth) && "*".equals(dayOfWeek)) {
            dow = "?";
        }
        return String.join(" ", sec, min, hour, dayOfMonth, month, dow);
    }

    private static long parseCount(String digits, String input) {
        try {
            long n = Long.parseLong(digits);
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative: " + input);
            }
            return n;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number in interval: " + input);
        }
    }

    private static String requireSpec(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }
        return s;
    }
}
