package io.github.drompincen.cronsync.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;

public record RemoveRequest(String id) implements CronRequest<JsonNode> {

    @Override
    public String method() {
        return "cron.remove";
    }

    @Override
    public Class<JsonNode> responseType() {
        return JsonNode.class;
    }
}
