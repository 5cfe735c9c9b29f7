package io.github.drompincen.cronsync.runtime.gateway;

import io.github.drompincen.cronsync.protocol.event.PushMessage;
import reactor.core.publisher.Flux;

public interface GatewayPushSource {

    /**
     * Ordered push messages; the stream runs until the subscriber disposes it.
     */
    Flux<PushMessage> messages();
}
