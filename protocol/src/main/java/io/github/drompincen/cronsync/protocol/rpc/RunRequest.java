package io.github.drompincen.cronsync.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;

public record RunRequest(String id, RunMode mode) implements CronRequest<JsonNode> {

    @Override
    public String method() {
        return "cron.run";
    }

    @Override
    public Class<JsonNode> responseType() {
        return JsonNode.class;
    }
}
