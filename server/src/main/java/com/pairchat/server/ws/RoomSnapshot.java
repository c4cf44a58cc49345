package com.pairchat.server.ws;

import org.springframework.web.socket.WebSocketSession;

import java.util.Set;

/**
 * Membership of one room right after a create, join or leave. An empty member set means the
 * room was dismissed by that leave.
 */
public record RoomSnapshot(String room, Set<WebSocketSession> members) {
    public boolean dismissed() {
        return members.isEmpty();
    }
}
