package io.github.drompincen.cronsync.runtime.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs of the sync engine.
 *
 * @param gapDebounce delay before the full resync that follows a push sequence gap; defaults
 *                    to the job-list debounce, {@link Duration#ZERO} resyncs on the next tick
 */
public record CronSyncSettings(
        Duration pollInterval,
        Duration jobsDebounce,
        Duration runsDebounce,
        Duration gapDebounce,
        Duration requestTimeout,
        Duration runTimeout,
        int runLogLimit
) {
    public CronSyncSettings {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(jobsDebounce, "jobsDebounce");
        Objects.requireNonNull(runsDebounce, "runsDebounce");
        Objects.requireNonNull(gapDebounce, "gapDebounce");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(runTimeout, "runTimeout");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (jobsDebounce.isNegative() || runsDebounce.isNegative() || gapDebounce.isNegative()) {
            throw new IllegalArgumentException("debounce delays must not be negative");
        }
        if (runLogLimit <= 0) {
            throw new IllegalArgumentException("runLogLimit must be positive");
        }
    }

    public static CronSyncSettings defaults() {
        return new CronSyncSettings(
                Duration.ofSeconds(30),
                Duration.ofMillis(250),
                Duration.ofMillis(200),
                Duration.ofMillis(250),
                Duration.ofSeconds(10),
                Duration.ofSeconds(20),
                200);
    }
}
