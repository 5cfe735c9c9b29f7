package io.github.drompincen.cronsync.runtime.gateway;

/**
 * A response arrived but its body did not have the expected shape.
 */
public class GatewayDecodeException extends GatewayException {

    public GatewayDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
