package io.github.drompincen.cronsync.protocol.rpc;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A typed gateway request. Each implementation names its RPC method and the record its
 * response body decodes into.
 *
 * @param <R> response type
 */
public interface CronRequest<R> {

    @JsonIgnore
    String method();

    @JsonIgnore
    Class<R> responseType();

    /** Object serialized as the request params; the request itself unless overridden. */
    @JsonIgnore
    default Object params() {
        return this;
    }
}
