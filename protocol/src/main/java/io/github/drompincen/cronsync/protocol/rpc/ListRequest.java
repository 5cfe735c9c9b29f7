package io.github.drompincen.cronsync.protocol.rpc;

import io.github.drompincen.cronsync.protocol.api.CronListResponse;

public record ListRequest(boolean includeDisabled) implements CronRequest<CronListResponse> {

    @Override
    public String method() {
        return "cron.list";
    }

    @Override
    public Class<CronListResponse> responseType() {
        return CronListResponse.class;
    }
}
