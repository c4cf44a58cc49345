package com.pairchat.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.pairchat.server.exception.RelayException;
import com.pairchat.server.exception.RoomNotFoundException;
import com.pairchat.server.model.ChatPayload;
import com.pairchat.server.model.EventType;
import com.pairchat.server.model.InboundEnvelope;
import com.pairchat.server.model.JoinRoomPayload;
import com.pairchat.server.model.SeenPayload;
import com.pairchat.server.model.ServerEvents;
import com.pairchat.server.model.TypingPayload;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;

/**
 * 中继分发器：
 * - 连接建立：登记到 ConnectionRegistry（尚未进入任何房间）
 * - 收到客户端文本：解析 envelope，按 type 校验后路由到发送者 / 整个房间 / 房间内其他人
 * - 连接关闭：退出房间，房间仍有人则广播 user-count，空了则解散
 */
@Component
public class ChatHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatHandler.class);

    private final ObjectMapper mapper = inboundMapper();
    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final ConnectionRegistry registry;
    private final RoomTable roomTable;
    private final EnvelopeSender sender;

    @Value("${relay.send.time-limit-ms:10000}")
    private int sendTimeLimitMs = 10000;

    @Value("${relay.send.buffer-size-limit:524288}")
    private int sendBufferSizeLimit = 512 * 1024;

    public ChatHandler(ConnectionRegistry registry, RoomTable roomTable, EnvelopeSender sender) {
        this.registry = registry;
        this.roomTable = roomTable;
        this.sender = sender;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        // 多个房间成员的线程可能同时往同一个 socket 写
        WebSocketSession conn = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
        registry.register(conn);
        log.info("[CONNECT] session={} live={}", session.getId(), registry.liveConnections());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        dispatch(session, message.getPayload());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        dispatch(session, StandardCharsets.UTF_8.decode(message.getPayload()).toString());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WARN] transport error session={} {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.unregister(session.getId(), room -> {
            if (room.dismissed()) {
                log.info("[DISMISS] room={}", room.room());
            } else {
                log.info("[LEAVE] room={} remaining={}", room.room(), room.members().size());
                announceCount(room);
            }
        });
        log.info("[DISCONNECT] session={} status={} live={}", session.getId(), status.getCode(), registry.liveConnections());
    }

    private void dispatch(WebSocketSession session, String text) {
        WebSocketSession conn = registry.lookup(session.getId()).orElse(null);
        if (conn == null) return; // closed while this frame was in flight

        // 1) 解析 JSON -> envelope
        InboundEnvelope envelope;
        try {
            JsonNode tree = mapper.readTree(text);
            if (tree == null || !tree.isObject()) throw new IllegalArgumentException("not a JSON object");
            envelope = mapper.treeToValue(tree, InboundEnvelope.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[WARN] invalid json session={} {}", session.getId(), e.getMessage());
            sender.send(conn, ServerEvents.error(ServerEvents.INVALID_JSON));
            return;
        }

        // 2) 按 type 分发；未知类型直接忽略
        EventType type = EventType.fromWire(envelope.type).orElse(null);
        if (type == null) {
            log.debug("[IGNORE] unknown type={} session={}", envelope.type, session.getId());
            return;
        }
        switch (type) {
            case CREATE_ROOM -> onCreateRoom(conn);
            case JOIN_ROOM -> onJoinRoom(conn, envelope.payload);
            case TYPING -> onTyping(conn, envelope.payload);
            case MESSAGE -> onMessage(conn, envelope.payload);
            case SEEN -> onSeen(conn, envelope.payload);
            default -> log.debug("[IGNORE] server-only type={} session={}", type.wireName(), session.getId());
        }
    }

    private void onCreateRoom(WebSocketSession conn) {
        Optional<RoomSnapshot> created;
        try {
            created = registry.createRoom(conn, room -> {
                log.info("[CREATE] room={} session={}", room.room(), conn.getId());
                sender.send(conn, ServerEvents.roomCreated(room.room()));
                announceCount(room);
            });
        } catch (RelayException e) {
            sender.send(conn, ServerEvents.error(e.getMessage()));
            return;
        }
        if (created.isEmpty()) {
            log.debug("[IGNORE] create-room from session={} already in a room", conn.getId());
        }
    }

    private void onJoinRoom(WebSocketSession conn, JsonNode payload) {
        if (registry.roomOf(conn.getId()).isPresent()) {
            log.debug("[IGNORE] join-room from session={} already in a room", conn.getId());
            return;
        }
        JoinRoomPayload request = bind(conn, payload, JoinRoomPayload.class).orElse(null);
        if (request == null) {
            sender.send(conn, ServerEvents.error(RoomNotFoundException.MESSAGE));
            return;
        }

        try {
            registry.joinRoom(request.room, conn, room -> {
                log.info("[JOIN] room={} session={} total={}", room.room(), conn.getId(), room.members().size());
                sender.send(conn, ServerEvents.joined(room.room()));
                announceCount(room);
            });
        } catch (RelayException e) {
            log.info("[REJECT] room={} session={} reason={}", request.room, conn.getId(), e.getMessage());
            sender.send(conn, ServerEvents.error(e.getMessage()));
        }
    }

    // 在 registry 锁内调用，保证同一房间的 user-count 按成员变化的顺序发出
    private void announceCount(RoomSnapshot room) {
        sender.broadcast(room.members(), ServerEvents.userCount(room.members().size(), roomTable.capacity()));
    }

    private void onTyping(WebSocketSession conn, JsonNode payload) {
        Set<WebSocketSession> members = currentRoomMembers(conn).orElse(null);
        if (members == null) return;
        bind(conn, payload, TypingPayload.class).ifPresent(t ->
                sender.broadcastExcept(members, ServerEvents.typing(t.typing), conn));
    }

    private void onMessage(WebSocketSession conn, JsonNode payload) {
        Set<WebSocketSession> members = currentRoomMembers(conn).orElse(null);
        if (members == null) return;
        ChatPayload chat = bind(conn, payload, ChatPayload.class).orElse(null);
        if (chat == null) return;

        // 发送者本地已经渲染过，只回 delivered
        sender.broadcastExcept(members, ServerEvents.message(chat.id, chat.text), conn);
        sender.send(conn, ServerEvents.delivered(chat.id));
    }

    private void onSeen(WebSocketSession conn, JsonNode payload) {
        Set<WebSocketSession> members = currentRoomMembers(conn).orElse(null);
        if (members == null) return;
        bind(conn, payload, SeenPayload.class).ifPresent(seen ->
                sender.broadcast(members, ServerEvents.seen(seen.id)));
    }

    private Optional<Set<WebSocketSession>> currentRoomMembers(WebSocketSession conn) {
        Optional<String> room = registry.roomOf(conn.getId());
        if (room.isEmpty()) {
            log.debug("[IGNORE] room-scoped event from session={} without a room", conn.getId());
            return Optional.empty();
        }
        return Optional.of(roomTable.membersOf(room.get()));
    }

    /**
     * 严格解析：JSON 之后不允许多余内容；字符串字段只接受 JSON 字符串，布尔字段只接受 true/false，
     * 不做数字/布尔与字符串之间的自动转换。
     */
    static ObjectMapper inboundMapper() {
        ObjectMapper mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        return mapper;
    }

    private <T> Optional<T> bind(WebSocketSession conn, JsonNode payload, Class<T> type) {
        if (payload == null || !payload.isObject()) {
            log.warn("[WARN] missing payload type={} session={}", type.getSimpleName(), conn.getId());
            return Optional.empty();
        }
        T value;
        try {
            value = mapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            log.warn("[WARN] bad payload type={} session={} {}", type.getSimpleName(), conn.getId(), e.getOriginalMessage());
            return Optional.empty();
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            log.warn("[WARN] validation failed session={} {}", conn.getId(), violations);
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
