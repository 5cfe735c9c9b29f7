package io.github.drompincen.cronsync.runtime.schedule;

import io.github.drompincen.cronsync.protocol.api.CronSchedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats the short duration literals ({@code 10m}, {@code 1.5h}, {@code 2d}) used by
 * {@code every} schedules, and renders one-line schedule summaries.
 */
public final class ScheduleCodec {

    private static final Pattern DURATION = Pattern.compile("^(\\d+(?:\\.\\d+)?)(ms|s|m|h|d)$",
            Pattern.CASE_INSENSITIVE);

    private static final long SECOND_MS = 1_000;
    private static final long MINUTE_MS = 60_000;
    private static final long HOUR_MS = 3_600_000;
    private static final long DAY_MS = 86_400_000;

    private ScheduleCodec() {}

    /**
     * Parses {@code <number><unit>} into whole milliseconds (floored).
     *
     * @return the duration, or empty when the text is blank, malformed, or not strictly positive
     */
    public static OptionalLong parseDurationMs(String input) {
        if (input == null) return OptionalLong.empty();
        String raw = input.trim();
        if (raw.isEmpty()) return OptionalLong.empty();

        Matcher m = DURATION.matcher(raw);
        if (!m.matches()) return OptionalLong.empty();

        double n = Double.parseDouble(m.group(1));
        if (!Double.isFinite(n) || n <= 0) return OptionalLong.empty();

        long factor = switch (m.group(2).toLowerCase(Locale.ROOT)) {
            case "ms" -> 1;
            case "s" -> SECOND_MS;
            case "m" -> MINUTE_MS;
            case "h" -> HOUR_MS;
            default -> DAY_MS;
        };
        return OptionalLong.of((long) Math.floor(n * factor));
    }

    public static String formatDurationMs(long ms) {
        if (ms < SECOND_MS) return ms + "ms";
        double s = ms / 1000.0;
        if (s < 60) return Math.round(s) + "s";
        double m = s / 60.0;
        if (m < 60) return Math.round(m) + "m";
        double h = m / 60.0;
        if (h < 48) return Math.round(h) + "h";
        double d = h / 24.0;
        return Math.round(d) + "d";
    }

    public static String summarize(CronSchedule schedule, ZoneId zone, Locale locale) {
        if (schedule instanceof CronSchedule.At at) {
            DateTimeFormatter fmt = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM)
                    .withLocale(locale)
                    .withZone(zone);
            return "at " + fmt.format(Instant.ofEpochMilli(at.atMs()));
        }
        if (schedule instanceof CronSchedule.Every every) {
            return "every " + formatDurationMs(every.everyMs());
        }
        if (schedule instanceof CronSchedule.Cron cron) {
            if (cron.tz() != null && !cron.tz().isEmpty()) {
                return "cron " + cron.expr() + " (" + cron.tz() + ")";
            }
            return "cron " + cron.expr();
        }
        throw new IllegalArgumentException("Unsupported schedule: " + schedule);
    }

    public static String summarize(CronSchedule schedule) {
        return summarize(schedule, ZoneId.systemDefault(), Locale.getDefault());
    }

    /**
     * Relative label for a job's next run, e.g. {@code "in 5m"} or {@code "due"}.
     */
    public static String nextRunLabel(long nextRunAtMs, long nowMs) {
        long deltaMs = nextRunAtMs - nowMs;
        if (deltaMs <= 0) return "due";
        if (deltaMs < MINUTE_MS) return "in <1m";
        long minutes = Math.round(deltaMs / (double) MINUTE_MS);
        if (minutes < 60) return "in " + minutes + "m";
        long hours = Math.round(minutes / 60.0);
        if (hours < 48) return "in " + hours + "h";
        return "in " + Math.round(hours / 24.0) + "d";
    }
}
