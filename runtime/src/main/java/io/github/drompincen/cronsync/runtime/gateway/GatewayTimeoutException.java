package io.github.drompincen.cronsync.runtime.gateway;

import java.time.Duration;

public class GatewayTimeoutException extends GatewayTransportException {

    public GatewayTimeoutException(String method, Duration timeout) {
        super(method + " timed out after " + timeout.toMillis() + "ms");
    }
}
