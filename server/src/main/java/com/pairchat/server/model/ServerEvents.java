package com.pairchat.server.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for every envelope the server emits.
 */
public final class ServerEvents {
    public static final String INVALID_JSON = "Invalid JSON format";

    private ServerEvents() {
    }

    public static OutboundEnvelope roomCreated(String room) {
        return of(EventType.ROOM_CREATED, "room", room);
    }

    public static OutboundEnvelope joined(String room) {
        return of(EventType.JOINED, "room", room);
    }

    public static OutboundEnvelope userCount(int count, int max) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("count", count);
        payload.put("max", max);
        return new OutboundEnvelope(EventType.USER_COUNT.wireName(), payload);
    }

    public static OutboundEnvelope typing(boolean typing) {
        return of(EventType.TYPING, "typing", typing);
    }

    public static OutboundEnvelope message(String id, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id);
        payload.put("message", text);
        return new OutboundEnvelope(EventType.MESSAGE.wireName(), payload);
    }

    public static OutboundEnvelope delivered(String id) {
        return of(EventType.DELIVERED, "id", id);
    }

    public static OutboundEnvelope seen(String id) {
        return of(EventType.SEEN, "id", id);
    }

    public static OutboundEnvelope error(String message) {
        return of(EventType.ERROR, "message", message);
    }

    private static OutboundEnvelope of(EventType type, String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        return new OutboundEnvelope(type.wireName(), payload);
    }
}
