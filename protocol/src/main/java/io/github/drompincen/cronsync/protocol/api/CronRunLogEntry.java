package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronRunLogEntry(
        long ts,
        String jobId,
        String action,
        String status,
        String error,
        Long runAtMs,
        Long durationMs,
        Long nextRunAtMs
) {}
