package io.github.drompincen.cronsync.runtime.sync;

import io.github.drompincen.cronsync.protocol.api.CronJob;
import io.github.drompincen.cronsync.protocol.api.CronRunLogEntry;

import java.util.List;
import java.util.Optional;

/**
 * Immutable view of everything the engine publishes to the presentation layer.
 */
public record CronSyncSnapshot(
        List<CronJob> jobs,
        String selectedJobId,
        List<CronRunLogEntry> runEntries,
        Boolean schedulerEnabled,
        String schedulerStorePath,
        Integer schedulerJobCount,
        Long schedulerNextWakeAtMs,
        boolean loadingJobs,
        boolean loadingRuns,
        boolean saving,
        String lastError,
        String statusMessage,
        boolean running
) {
    public CronSyncSnapshot {
        jobs = List.copyOf(jobs);
        runEntries = List.copyOf(runEntries);
    }

    public static CronSyncSnapshot empty() {
        return new CronSyncSnapshot(List.of(), null, List.of(), null, null, null, null,
                false, false, false, null, null, false);
    }

    public Optional<CronJob> findJob(String jobId) {
        return jobs.stream().filter(j -> j.id().equals(jobId)).findFirst();
    }

    public Optional<CronJob> selectedJob() {
        return selectedJobId == null ? Optional.empty() : findJob(selectedJobId);
    }
}
