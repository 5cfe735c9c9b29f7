package io.github.drompincen.cronsync.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One message of the gateway's ordered push channel.
 */
public interface PushMessage {

    /**
     * A named domain event. {@code payload} is kept raw; consumers decode the events they
     * care about.
     */
    record GatewayEvent(String event, JsonNode payload, Long seq) implements PushMessage {}

    /**
     * Messages were lost or reordered between {@code expected} and {@code received}. Whatever
     * the client derived from earlier events can no longer be trusted.
     */
    record SequenceGap(long expected, long received) implements PushMessage {}
}
