package io.github.drompincen.cronsync.runtime.gateway;

/**
 * The gateway answered with {@code ok: false}, e.g. for an unknown job id.
 */
public class GatewayRemoteException extends GatewayException {

    private final String code;

    public GatewayRemoteException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
