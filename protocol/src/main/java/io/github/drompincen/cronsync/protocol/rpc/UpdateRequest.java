package io.github.drompincen.cronsync.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.cronsync.protocol.api.CronJobInput;

public record UpdateRequest(String id, CronJobInput patch) implements CronRequest<JsonNode> {

    @Override
    public String method() {
        return "cron.update";
    }

    @Override
    public Class<JsonNode> responseType() {
        return JsonNode.class;
    }
}
