package com.pairchat.server.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Envelope kinds understood by the relay, keyed by their wire name.
 */
public enum EventType {
    // client -> server
    CREATE_ROOM("create-room"),
    JOIN_ROOM("join-room"),
    TYPING("typing"),
    MESSAGE("message"),
    SEEN("seen"),

    // server -> client
    ROOM_CREATED("room-created"),
    JOINED("joined"),
    USER_COUNT("user-count"),
    DELIVERED("delivered"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<EventType> fromWire(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
