package com.pairchat.server.ws;

import com.pairchat.server.exception.RoomCodesExhaustedException;
import com.pairchat.server.exception.RoomFullException;
import com.pairchat.server.exception.RoomNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Owns every open room and its member set. A room is created together with its first member
 * and removed in the same step that removes its last one, so an empty room is never visible.
 * All methods hold this table's monitor; callers that also touch {@link ConnectionRegistry}
 * enter through the registry, which always locks first.
 */
@Component
public class RoomTable {
    private static final Logger log = LoggerFactory.getLogger(RoomTable.class);

    private final Map<String, Set<WebSocketSession>> rooms = new HashMap<>();

    private final RoomCodeGenerator codes;
    private final int capacity;
    private final int codeAttempts;

    public RoomTable(RoomCodeGenerator codes,
                     @Value("${relay.room.capacity:2}") int capacity,
                     @Value("${relay.room.code-attempts:100}") int codeAttempts) {
        if (capacity < 1) throw new IllegalArgumentException("room capacity must be >= 1, was " + capacity);
        if (codeAttempts < 1) throw new IllegalArgumentException("code attempts must be >= 1, was " + codeAttempts);
        this.codes = codes;
        this.capacity = capacity;
        this.codeAttempts = codeAttempts;
    }

    /**
     * Opens a room under a code no open room holds and places {@code creator} in it.
     *
     * @return the new room's code
     * @throws RoomCodesExhaustedException if every attempt hit a code already in use
     */
    public synchronized String createRoom(WebSocketSession creator) {
        for (int attempt = 1; attempt <= codeAttempts; attempt++) {
            String code = codes.next();
            if (rooms.containsKey(code)) {
                log.debug("[CODE] collision room={} attempt={}", code, attempt);
                continue;
            }
            Set<WebSocketSession> members = new LinkedHashSet<>();
            members.add(creator);
            rooms.put(code, members);
            return code;
        }
        log.warn("[WARN] no free room code after {} attempts, open rooms={}", codeAttempts, rooms.size());
        throw new RoomCodesExhaustedException(codeAttempts);
    }

    /**
     * Adds {@code session} to an open room. Capacity check and insertion happen under one lock.
     *
     * @return the members after the join
     */
    public synchronized Set<WebSocketSession> join(String code, WebSocketSession session) {
        Set<WebSocketSession> members = rooms.get(code);
        if (members == null) throw new RoomNotFoundException(code);
        if (members.size() >= capacity) throw new RoomFullException(code);
        members.add(session);
        return Set.copyOf(members);
    }

    /**
     * Removes {@code session} from the room; the room is deleted if that was its last member.
     *
     * @return the members left behind, empty when the room is gone
     */
    public synchronized Set<WebSocketSession> leave(String code, WebSocketSession session) {
        Set<WebSocketSession> members = rooms.get(code);
        if (members == null) return Set.of();
        members.remove(session);
        if (members.isEmpty()) {
            rooms.remove(code);
            return Set.of();
        }
        return Set.copyOf(members);
    }

    public synchronized Set<WebSocketSession> membersOf(String code) {
        Set<WebSocketSession> members = rooms.get(code);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public synchronized boolean isOpen(String code) {
        return rooms.containsKey(code);
    }

    public synchronized int openRooms() {
        return rooms.size();
    }

    public int capacity() {
        return capacity;
    }
}
