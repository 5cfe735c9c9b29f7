package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronJob(
        String id,
        String name,
        boolean enabled,
        long createdAtMs,
        long updatedAtMs,
        CronSchedule schedule,
        SessionTarget sessionTarget,
        WakeMode wakeMode,
        CronPayload payload,
        CronIsolation isolation,
        CronJobState state
) {
    @JsonIgnore
    public String displayName() {
        if (name != null && !name.isBlank()) return name.trim();
        return id;
    }
}
