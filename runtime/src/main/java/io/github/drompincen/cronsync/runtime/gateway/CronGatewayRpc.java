package io.github.drompincen.cronsync.runtime.gateway;

import io.github.drompincen.cronsync.protocol.rpc.CronRequest;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response surface of the gateway's cron service.
 */
public interface CronGatewayRpc {

    /**
     * Sends {@code request} and completes with its decoded response, or exceptionally with a
     * {@link GatewayException} subtype. Never throws synchronously.
     */
    <R> CompletableFuture<R> call(CronRequest<R> request, Duration timeout);
}
