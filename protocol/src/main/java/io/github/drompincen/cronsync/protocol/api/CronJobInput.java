package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of a {@code cron.add} request, or the patch of a {@code cron.update} request.
 * Every field is optional on the wire; absent fields are left untouched by an update.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronJobInput(
        String name,
        Boolean enabled,
        CronSchedule schedule,
        SessionTarget sessionTarget,
        WakeMode wakeMode,
        CronPayload payload,
        CronIsolation isolation
) {
    public static CronJobInput enabledOnly(boolean enabled) {
        return new CronJobInput(null, enabled, null, null, null, null, null);
    }
}
