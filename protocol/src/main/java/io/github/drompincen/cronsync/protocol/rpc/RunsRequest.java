package io.github.drompincen.cronsync.protocol.rpc;

import io.github.drompincen.cronsync.protocol.api.CronRunsResponse;

public record RunsRequest(String id, int limit) implements CronRequest<CronRunsResponse> {

    @Override
    public String method() {
        return "cron.runs";
    }

    @Override
    public Class<CronRunsResponse> responseType() {
        return CronRunsResponse.class;
    }
}
