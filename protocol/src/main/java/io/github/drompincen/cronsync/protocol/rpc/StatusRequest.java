package io.github.drompincen.cronsync.protocol.rpc;

import io.github.drompincen.cronsync.protocol.api.CronStatusResponse;

public record StatusRequest() implements CronRequest<CronStatusResponse> {

    @Override
    public String method() {
        return "cron.status";
    }

    @Override
    public Class<CronStatusResponse> responseType() {
        return CronStatusResponse.class;
    }

    @Override
    public Object params() {
        return null;
    }
}
