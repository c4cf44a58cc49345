package com.pairchat.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * One envelope received from the relay.
 */
public record ServerEvent(String type, JsonNode payload) {

    public ServerEvent {
        if (payload == null) payload = MissingNode.getInstance();
    }

    public String text(String field) {
        JsonNode v = payload.path(field);
        return v.isValueNode() ? v.asText() : null;
    }

    public int number(String field) {
        return payload.path(field).asInt();
    }

    public boolean flag(String field) {
        return payload.path(field).asBoolean();
    }
}
