package io.github.drompincen.cronsync.app.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.cronsync.runtime.sync.CronSyncEngine;
import io.github.drompincen.cronsync.runtime.sync.CronSyncSnapshot;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes every engine snapshot to connected browser clients as
 * {@code {"type":"SNAPSHOT","payload":...}}. Each session subscribes to the engine on its own,
 * so it starts from the current snapshot and never sees an older one afterwards.
 */
@Component
public class CronSnapshotWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(CronSnapshotWebSocketHandler.class);

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final CronSyncEngine engine;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    public CronSnapshotWebSocketHandler(ObjectMapper objectMapper, CronSyncEngine engine) {
        this.objectMapper = objectMapper;
        this.engine = engine;
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.keySet().forEach(this::drop);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        // a slow client fills its own buffer instead of stalling snapshot delivery
        WebSocketSession bounded = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        Subscription subscription = new Subscription();
        subscriptions.put(session.getId(), subscription);
        // the first snapshot is delivered inside subscribe and may already drop the session
        subscription.registration = engine.subscribe(snapshot -> send(bounded, snapshot));
        if (subscription.dropped) {
            subscription.registration.close();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        drop(session.getId());
    }

    int sessionCount() {
        return subscriptions.size();
    }

    private void send(WebSocketSession ws, CronSyncSnapshot snapshot) {
        if (!ws.isOpen()) {
            drop(ws.getId());
            return;
        }
        try {
            ws.sendMessage(toMessage(snapshot));
        } catch (JsonProcessingException e) {
            log.error("Error serializing cron snapshot", e);
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("Dropping WebSocket session {}: {}", ws.getId(), e.getMessage());
            drop(ws.getId());
        }
    }

    private void drop(String sessionId) {
        Subscription subscription = subscriptions.remove(sessionId);
        if (subscription == null) return;
        subscription.dropped = true;
        CronSyncEngine.Registration registration = subscription.registration;
        if (registration != null) {
            registration.close();
        }
    }

    private TextMessage toMessage(CronSyncSnapshot snapshot) throws JsonProcessingException {
        return new TextMessage(objectMapper.writeValueAsString(Map.of("type", "SNAPSHOT", "payload", snapshot)));
    }

    private static final class Subscription {
        volatile CronSyncEngine.Registration registration;
        volatile boolean dropped;
    }
}
