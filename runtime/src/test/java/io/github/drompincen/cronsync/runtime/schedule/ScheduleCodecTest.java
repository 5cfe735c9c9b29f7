package io.github.drompincen.cronsync.runtime.schedule;

import io.github.drompincen.cronsync.protocol.api.CronSchedule;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleCodecTest {

    @Test
    void parsesEachUnit() {
        assertThat(ScheduleCodec.parseDurationMs("250ms")).hasValue(250);
        assertThat(ScheduleCodec.parseDurationMs("30s")).hasValue(30_000);
        assertThat(ScheduleCodec.parseDurationMs("10m")).hasValue(600_000);
        assertThat(ScheduleCodec.parseDurationMs("1.5h")).hasValue(5_400_000);
        assertThat(ScheduleCodec.parseDurationMs("  2d  ")).hasValue(172_800_000);
    }

    @Test
    void unitIsCaseInsensitive() {
        assertThat(ScheduleCodec.parseDurationMs("10M")).hasValue(600_000);
        assertThat(ScheduleCodec.parseDurationMs("5MS")).hasValue(5);
    }

    @Test
    void fractionalResultIsFloored() {
        assertThat(ScheduleCodec.parseDurationMs("1.9ms")).hasValue(1);
    }

    @Test
    void rejectsMalformedOrNonPositiveInput() {
        assertThat(ScheduleCodec.parseDurationMs("0m")).isEmpty();
        assertThat(ScheduleCodec.parseDurationMs("10x")).isEmpty();
        assertThat(ScheduleCodec.parseDurationMs("")).isEmpty();
        assertThat(ScheduleCodec.parseDurationMs("   ")).isEmpty();
        assertThat(ScheduleCodec.parseDurationMs(null)).isEmpty();
        assertThat(ScheduleCodec.parseDurationMs("-5m")).isEmpty();
        assertThat(ScheduleCodec.parseDurationMs("1 h")).isEmpty();
        assertThat(ScheduleCodec.parseDurationMs("h")).isEmpty();
    }

    @Test
    void formatsIntoLargestRoundedUnit() {
        assertThat(ScheduleCodec.formatDurationMs(500)).isEqualTo("500ms");
        assertThat(ScheduleCodec.formatDurationMs(1_500)).isEqualTo("2s");
        assertThat(ScheduleCodec.formatDurationMs(90_000)).isEqualTo("2m");
        assertThat(ScheduleCodec.formatDurationMs(7_200_000)).isEqualTo("2h");
        assertThat(ScheduleCodec.formatDurationMs(172_800_000)).isEqualTo("2d");
    }

    @Test
    void hoursAreKeptBelowTwoDays() {
        assertThat(ScheduleCodec.formatDurationMs(86_400_000)).isEqualTo("24h");
        assertThat(ScheduleCodec.formatDurationMs(3_600_000)).isEqualTo("1h");
    }

    @Test
    void summarizesEverySchedule() {
        assertThat(ScheduleCodec.summarize(CronSchedule.Every.of(3_600_000))).isEqualTo("every 1h");
    }

    @Test
    void summarizesCronWithAndWithoutZone() {
        assertThat(ScheduleCodec.summarize(new CronSchedule.Cron("0 9 * * 3", null)))
                .isEqualTo("cron 0 9 * * 3");
        assertThat(ScheduleCodec.summarize(new CronSchedule.Cron("0 9 * * 3", "Europe/Berlin")))
                .isEqualTo("cron 0 9 * * 3 (Europe/Berlin)");
    }

    @Test
    void summarizesAtScheduleInGivenZone() {
        String summary = ScheduleCodec.summarize(new CronSchedule.At(0L), ZoneOffset.UTC, Locale.US);

        assertThat(summary).startsWith("at ").contains("1970");
    }

    @Test
    void nextRunLabelRelativeToNow() {
        long now = 1_000_000;
        assertThat(ScheduleCodec.nextRunLabel(now - 1, now)).isEqualTo("due");
        assertThat(ScheduleCodec.nextRunLabel(now + 30_000, now)).isEqualTo("in <1m");
        assertThat(ScheduleCodec.nextRunLabel(now + 5 * 60_000, now)).isEqualTo("in 5m");
        assertThat(ScheduleCodec.nextRunLabel(now + 3 * 3_600_000, now)).isEqualTo("in 3h");
        assertThat(ScheduleCodec.nextRunLabel(now + 72L * 3_600_000, now)).isEqualTo("in 3d");
    }

    @Test
    void summaryUsesSystemZoneByDefault() {
        CronSchedule at = new CronSchedule.At(0L);
        assertThat(ScheduleCodec.summarize(at))
                .isEqualTo(ScheduleCodec.summarize(at, ZoneId.systemDefault(), Locale.getDefault()));
    }
}
