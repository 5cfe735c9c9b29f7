package io.github.drompincen.cronsync.runtime.gateway;

/**
 * The call never produced a response: connection refused, socket closed, send failed.
 */
public class GatewayTransportException extends GatewayException {

    public GatewayTransportException(String message) {
        super(message);
    }

    public GatewayTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
