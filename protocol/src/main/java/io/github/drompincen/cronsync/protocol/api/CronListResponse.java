package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronListResponse(List<CronJob> jobs) {
    public CronListResponse {
        jobs = jobs != null ? List.copyOf(jobs) : List.of();
    }
}
