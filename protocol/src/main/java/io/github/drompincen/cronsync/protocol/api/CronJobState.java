package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronJobState(
        Long nextRunAtMs,
        Long runningAtMs,
        Long lastRunAtMs,
        String lastStatus,
        String lastError,
        Long lastDurationMs
) {
    public static CronJobState empty() {
        return new CronJobState(null, null, null, null, null, null);
    }
}
