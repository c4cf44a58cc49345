package com.pairchat.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WebSocket client for the relay protocol.
 * <p>
 * A dropped socket is reopened after a fixed delay until {@link #close()} is called. The new
 * socket is a new connection on the server: it has no room and must create or join again.
 */
public class RelayClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(RelayClient.class);

    private final ClientConfig config;
    private final RelayListener listener;
    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient http = new OkHttpClient.Builder().build();
    private final ScheduledExecutorService reconnector = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "relay-reconnect");
        t.setDaemon(true);
        return t;
    });
    private final AtomicInteger reconnects = new AtomicInteger();

    private volatile WebSocket ws;
    private volatile boolean closed;

    public RelayClient(ClientConfig config, RelayListener listener) {
        this.config = config;
        this.listener = listener;
    }

    public void connect() {
        if (closed) return;
        Request req = new Request.Builder().url(config.relayUrl()).build();
        http.newWebSocket(req, new SocketListener());
        log.debug("[CONNECT] url={}", config.relayUrl());
    }

    public boolean isConnected() {
        return ws != null;
    }

    public int reconnects() {
        return reconnects.get();
    }

    public boolean createRoom() {
        return send("create-room", null);
    }

    public boolean joinRoom(String room) {
        if (room == null || room.isBlank()) return false;
        return send("join-room", Map.of("room", room.trim()));
    }

    public boolean typing(boolean typing) {
        return send("typing", Map.of("typing", typing));
    }

    /**
     * Sends a chat line under a fresh id.
     *
     * @return the id the relay will acknowledge with {@code delivered}, or empty if nothing was sent
     */
    public Optional<String> sendMessage(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String id = UUID.randomUUID().toString();
        return send("message", Map.of("id", id, "text", text)) ? Optional.of(id) : Optional.empty();
    }

    public boolean seen(String id) {
        if (id == null || id.isEmpty()) return false;
        return send("seen", Map.of("id", id));
    }

    private boolean send(String type, Map<String, Object> payload) {
        WebSocket current = ws;
        if (current == null) {
            log.debug("[DROP] type={} not connected", type);
            return false;
        }
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("type", type);
        if (payload != null) envelope.set("payload", mapper.valueToTree(payload));
        return current.send(envelope.toString());
    }

    @Override
    public void close() {
        closed = true;
        WebSocket current = ws;
        ws = null;
        if (current != null) current.close(1000, "bye");
        reconnector.shutdownNow();
        http.dispatcher().executorService().shutdown();
    }

    private void dropped(WebSocket socket) {
        if (ws == socket) ws = null;
        listener.onDisconnected();
        if (closed) return;
        reconnects.incrementAndGet();
        log.info("[RECONNECT] in {}ms", config.reconnectDelayMs());
        try {
            reconnector.schedule(this::connect, config.reconnectDelayMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[RECONNECT] skipped, client closed");
        }
    }

    private final class SocketListener extends WebSocketListener {
        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            if (closed) {
                webSocket.close(1000, "bye");
                return;
            }
            ws = webSocket;
            log.info("[OPEN] url={}", config.relayUrl());
            listener.onConnected();
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            JsonNode tree;
            try {
                tree = mapper.readTree(text);
            } catch (JsonProcessingException e) {
                log.warn("[WARN] unreadable frame {}", e.getOriginalMessage());
                return;
            }
            listener.onEvent(new ServerEvent(tree.path("type").asText(), tree.get("payload")));
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            log.info("[CLOSED] code={} reason={}", code, reason);
            dropped(webSocket);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            log.warn("[WARN] socket failure {}", t.getMessage());
            dropped(webSocket);
        }
    }
}
