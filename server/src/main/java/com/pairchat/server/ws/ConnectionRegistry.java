package com.pairchat.server.ws;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Live connections and the room each one is assigned to.
 * <p>
 * This is the global guard for room state: every mutation that touches both the registry and
 * {@link RoomTable} runs under this object's monitor, and the table's monitor is only ever
 * taken inside it. A connection gets at most one room for its whole lifetime.
 * <p>
 * The {@code announce} callbacks run before the guard is released, so membership
 * notifications for one room go out in the order the membership changed.
 */
@Component
public class ConnectionRegistry {

    private final Map<String, WebSocketSession> live = new HashMap<>();
    private final Map<String, String> assignments = new HashMap<>();

    private final RoomTable roomTable;

    public ConnectionRegistry(RoomTable roomTable) {
        this.roomTable = roomTable;
    }

    public synchronized void register(WebSocketSession session) {
        live.put(session.getId(), session);
    }

    public synchronized Optional<WebSocketSession> lookup(String sessionId) {
        return Optional.ofNullable(live.get(sessionId));
    }

    public synchronized Optional<String> roomOf(String sessionId) {
        return Optional.ofNullable(assignments.get(sessionId));
    }

    public Optional<RoomSnapshot> createRoom(WebSocketSession session) {
        return createRoom(session, room -> {});
    }

    /**
     * Opens a room for {@code session}.
     *
     * @return the new room, or empty if the connection already has one
     */
    public synchronized Optional<RoomSnapshot> createRoom(WebSocketSession session, Consumer<RoomSnapshot> announce) {
        if (assignments.containsKey(session.getId())) return Optional.empty();
        String code = roomTable.createRoom(session);
        assignments.put(session.getId(), code);
        RoomSnapshot created = new RoomSnapshot(code, roomTable.membersOf(code));
        announce.accept(created);
        return Optional.of(created);
    }

    public Optional<RoomSnapshot> joinRoom(String code, WebSocketSession session) {
        return joinRoom(code, session, room -> {});
    }

    /**
     * Puts {@code session} into room {@code code}. Room table failures propagate unchanged.
     *
     * @return the room after the join, or empty if the connection already has one
     */
    public synchronized Optional<RoomSnapshot> joinRoom(String code, WebSocketSession session,
                                                        Consumer<RoomSnapshot> announce) {
        if (assignments.containsKey(session.getId())) return Optional.empty();
        RoomSnapshot joined = new RoomSnapshot(code, roomTable.join(code, session));
        assignments.put(session.getId(), code);
        announce.accept(joined);
        return Optional.of(joined);
    }

    public Optional<RoomSnapshot> unregister(String sessionId) {
        return unregister(sessionId, room -> {});
    }

    /**
     * Forgets a closed connection and takes it out of its room.
     *
     * @return the room it left, or empty if it never had one
     */
    public synchronized Optional<RoomSnapshot> unregister(String sessionId, Consumer<RoomSnapshot> announce) {
        WebSocketSession session = live.remove(sessionId);
        String code = assignments.remove(sessionId);
        if (session == null || code == null) return Optional.empty();
        RoomSnapshot left = new RoomSnapshot(code, roomTable.leave(code, session));
        announce.accept(left);
        return Optional.of(left);
    }

    public synchronized int liveConnections() {
        return live.size();
    }
}
