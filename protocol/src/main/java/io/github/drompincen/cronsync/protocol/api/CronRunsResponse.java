package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronRunsResponse(List<CronRunLogEntry> entries) {
    public CronRunsResponse {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }
}
