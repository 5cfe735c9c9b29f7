package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronIsolation(
        Boolean postToMain,
        String postToMainPrefix
) {
    public static CronIsolation disabled() {
        return new CronIsolation(false, null);
    }
}
