package io.github.drompincen.cronsync.runtime.gateway;

/**
 * Base of every failure reported by the gateway boundary.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
