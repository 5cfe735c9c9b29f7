package io.github.drompincen.cronsync.protocol.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronEvent(
        String jobId,
        String action,
        Long runAtMs,
        Long durationMs,
        String status,
        String error,
        Long nextRunAtMs
) {
    public static final String EVENT_NAME = "cron";
    public static final String ACTION_FINISHED = "finished";

    public CronEvent {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("cron event without jobId");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("cron event without action");
        }
    }

    @JsonIgnore
    public boolean isFinished() {
        return ACTION_FINISHED.equals(action);
    }
}
