package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * When a job runs. Carried opaquely between the gateway and the client; the client never
 * evaluates cron expressions itself.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronSchedule.At.class, name = "at"),
        @JsonSubTypes.Type(value = CronSchedule.Every.class, name = "every"),
        @JsonSubTypes.Type(value = CronSchedule.Cron.class, name = "cron")
})
public interface CronSchedule {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record At(long atMs) implements CronSchedule {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Every(long everyMs, Long anchorMs) implements CronSchedule {
        public static Every of(long everyMs) {
            return new Every(everyMs, null);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Cron(String expr, String tz) implements CronSchedule {}
}
