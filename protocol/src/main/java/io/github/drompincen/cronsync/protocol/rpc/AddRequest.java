package io.github.drompincen.cronsync.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.cronsync.protocol.api.CronJobInput;

/**
 * Creates a job. The job body is sent as the params object itself, not wrapped.
 */
public record AddRequest(CronJobInput job) implements CronRequest<JsonNode> {

    @Override
    public String method() {
        return "cron.add";
    }

    @Override
    public Class<JsonNode> responseType() {
        return JsonNode.class;
    }

    @Override
    public Object params() {
        return job;
    }
}
