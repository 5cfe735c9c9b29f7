package io.github.drompincen.cronsync.app.transport;

import io.github.drompincen.cronsync.protocol.event.PushMessage;
import io.github.drompincen.cronsync.protocol.rpc.CronRequest;
import io.github.drompincen.cronsync.runtime.gateway.CronGatewayRpc;
import io.github.drompincen.cronsync.runtime.gateway.GatewayDecodeException;
import io.github.drompincen.cronsync.runtime.gateway.GatewayPushSource;
import io.github.drompincen.cronsync.runtime.gateway.GatewayRemoteException;
import io.github.drompincen.cronsync.runtime.gateway.GatewayTimeoutException;
import io.github.drompincen.cronsync.runtime.gateway.GatewayTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Gateway client over a single JSON WebSocket. Requests are correlated with responses by id;
 * event frames are republished as {@link PushMessage}s. The socket reconnects two seconds
 * after it drops until {@link #close()} is called.
 */
public class GatewayConnection implements CronGatewayRpc, GatewayPushSource, WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(GatewayConnection.class);

    private static final long RECONNECT_DELAY_SECONDS = 2;

    private final URI uri;
    private final HttpClient httpClient;
    private final GatewayFrameCodec codec;
    private final Map<String, PendingCall<?>> pending = new ConcurrentHashMap<>();
    private final Sinks.Many<PushMessage> sink = Sinks.many().multicast().directBestEffort();
    private final StringBuilder buffer = new StringBuilder();

    private volatile WebSocket webSocket;
    private volatile boolean closed;
    private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

    public GatewayConnection(URI uri, HttpClient httpClient, GatewayFrameCodec codec) {
        this.uri = uri;
        this.httpClient = httpClient;
        this.codec = codec;
    }

    public void connect() {
        if (closed) return;
        httpClient.newWebSocketBuilder()
                .buildAsync(uri, this)
                .exceptionally(ex -> {
                    log.warn("Gateway connect to {} failed: {}", uri, ex.getMessage());
                    scheduleReconnect();
                    return null;
                });
    }

    public void close() {
        closed = true;
        WebSocket ws = webSocket;
        webSocket = null;
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "client shutdown");
        }
        failPending("gateway connection closed");
        codec.reset();
        sink.tryEmitComplete();
    }

    public boolean isConnected() {
        return webSocket != null;
    }

    // ------------------------------------------------------------------
    // CronGatewayRpc / GatewayPushSource
    // ------------------------------------------------------------------

    @Override
    public <R> CompletableFuture<R> call(CronRequest<R> request, Duration timeout) {
        WebSocket ws = webSocket;
        if (ws == null) {
            return CompletableFuture.failedFuture(
                    new GatewayTransportException("not connected to gateway, " + request.method() + " not sent"));
        }
        String id = UUID.randomUUID().toString();
        String frame;
        try {
            frame = codec.encodeRequest(id, request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<R> future = new CompletableFuture<>();
        pending.put(id, new PendingCall<>(request, future));
        future.whenComplete((r, err) -> pending.remove(id));
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .execute(() -> future.completeExceptionally(new GatewayTimeoutException(request.method(), timeout)));

        send(ws, frame).whenComplete((sent, err) -> {
            if (err != null) {
                future.completeExceptionally(
                        new GatewayTransportException("sending " + request.method() + " failed", err));
            }
        });
        return future;
    }

    @Override
    public Flux<PushMessage> messages() {
        return sink.asFlux();
    }

    // ------------------------------------------------------------------
    // WebSocket.Listener
    // ------------------------------------------------------------------

    @Override
    public void onOpen(WebSocket ws) {
        webSocket = ws;
        log.info("Connected to gateway {}", uri);
        ws.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
        buffer.append(data);
        if (last) {
            String text = buffer.toString();
            buffer.setLength(0);
            handleFrame(text);
        }
        ws.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
        disconnected("closed with " + statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason));
        return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
        disconnected(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
    }

    void handleFrame(String text) {
        codec.decode(text).ifPresent(frame -> {
            if (frame instanceof GatewayFrameCodec.Response response) {
                resolve(response);
            } else if (frame instanceof GatewayFrameCodec.Push push) {
                for (PushMessage message : push.messages()) {
                    Sinks.EmitResult result = sink.tryEmitNext(message);
                    if (result.isFailure()) {
                        log.debug("Push message not delivered ({}): {}", result, message);
                    }
                }
            }
        });
    }

    private void resolve(GatewayFrameCodec.Response response) {
        PendingCall<?> call = pending.remove(response.id());
        if (call == null) {
            log.debug("Response for unknown or expired request {}", response.id());
            return;
        }
        call.complete(response, codec);
    }

    private synchronized CompletableFuture<?> send(WebSocket ws, String frame) {
        // WebSocket allows only one outstanding sendText
        CompletableFuture<?> next = lastSend
                .handle((r, err) -> null)
                .thenCompose(ignored -> ws.sendText(frame, true));
        lastSend = next;
        return next;
    }

    private void disconnected(String reason) {
        webSocket = null;
        buffer.setLength(0);
        // keep the last seq so events missed while down surface as a gap after reconnecting
        if (closed) return;
        log.warn("Gateway connection lost: {}. Reconnecting in {}s", reason, RECONNECT_DELAY_SECONDS);
        failPending("gateway connection lost: " + reason);
        scheduleReconnect();
    }

    private void failPending(String reason) {
        List<PendingCall<?>> calls = new ArrayList<>(pending.values());
        pending.clear();
        for (PendingCall<?> call : calls) {
            call.future().completeExceptionally(new GatewayTransportException(reason));
        }
    }

    private void scheduleReconnect() {
        if (closed) return;
        CompletableFuture.delayedExecutor(RECONNECT_DELAY_SECONDS, TimeUnit.SECONDS).execute(this::connect);
    }

    private record PendingCall<R>(CronRequest<R> request, CompletableFuture<R> future) {

        void complete(GatewayFrameCodec.Response response, GatewayFrameCodec codec) {
            if (!response.ok()) {
                String message = response.errorMessage() != null
                        ? response.errorMessage()
                        : request.method() + " failed";
                future.completeExceptionally(new GatewayRemoteException(response.errorCode(), message));
                return;
            }
            try {
                future.complete(codec.decodePayload(request, response.payload()));
            } catch (GatewayDecodeException e) {
                future.completeExceptionally(e);
            }
        }
    }
}
