package io.github.drompincen.cronsync.app.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.cronsync.protocol.event.PushMessage;
import io.github.drompincen.cronsync.protocol.rpc.CronRequest;
import io.github.drompincen.cronsync.runtime.gateway.GatewayDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Encodes request frames and decodes response / event frames of the gateway socket.
 *
 * <p>Event frames carry a monotonically increasing {@code seq}. When a frame skips ahead (or
 * goes backwards) a {@link PushMessage.SequenceGap} is emitted before the event itself. Not
 * thread-safe: one instance per connection, fed from the socket's listener callbacks.
 */
public class GatewayFrameCodec {

    private static final Logger log = LoggerFactory.getLogger(GatewayFrameCodec.class);

    public interface Frame {}

    public record Response(String id, boolean ok, JsonNode payload, String errorCode,
                           String errorMessage) implements Frame {}

    public record Push(List<PushMessage> messages) implements Frame {}

    private final ObjectMapper objectMapper;
    private Long lastSeq;

    public GatewayFrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encodeRequest(String id, CronRequest<?> request) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "req");
        frame.put("id", id);
        frame.put("method", request.method());
        Object params = request.params();
        if (params != null) {
            frame.set("params", objectMapper.valueToTree(params));
        }
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + request.method() + " request", e);
        }
    }

    public Optional<Frame> decode(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unparseable gateway frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        String type = node.path("type").asText();
        switch (type) {
            case "res":
                return decodeResponse(node);
            case "event":
                return decodeEvent(node);
            default:
                log.debug("Ignoring gateway frame of type '{}'", type);
                return Optional.empty();
        }
    }

    /**
     * Converts a successful response payload into the request's response type.
     *
     * @throws GatewayDecodeException when the payload is missing or does not fit the type
     */
    public <R> R decodePayload(CronRequest<R> request, JsonNode payload) {
        Class<R> type = request.responseType();
        if (type == JsonNode.class) {
            return type.cast(payload != null ? payload : NullNode.getInstance());
        }
        if (payload == null || payload.isNull()) {
            throw new GatewayDecodeException(request.method() + " returned no payload", null);
        }
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new GatewayDecodeException("Cannot decode " + request.method() + " response: "
                    + e.getMessage(), e);
        }
    }

    /** Forgets the last seen sequence number; the next event starts a fresh run. */
    public void reset() {
        lastSeq = null;
    }

    private Optional<Frame> decodeResponse(JsonNode node) {
        String id = node.path("id").asText(null);
        if (id == null) {
            log.warn("Skipping response frame without id");
            return Optional.empty();
        }
        JsonNode error = node.path("error");
        return Optional.of(new Response(
                id,
                node.path("ok").asBoolean(false),
                node.get("payload"),
                error.path("code").asText(null),
                error.path("message").asText(null)));
    }

    private Optional<Frame> decodeEvent(JsonNode node) {
        String event = node.path("event").asText(null);
        if (event == null) {
            log.warn("Skipping event frame without name");
            return Optional.empty();
        }
        JsonNode seqNode = node.get("seq");
        Long seq = seqNode != null && seqNode.canConvertToLong() ? seqNode.asLong() : null;

        List<PushMessage> messages = new ArrayList<>(2);
        if (seq != null) {
            if (lastSeq != null && seq != lastSeq + 1) {
                messages.add(new PushMessage.SequenceGap(lastSeq + 1, seq));
            }
            lastSeq = seq;
        }
        messages.add(new PushMessage.GatewayEvent(event, node.get("payload"), seq));
        return Optional.of(new Push(List.copyOf(messages)));
    }
}
