package com.pairchat.server.model;

import java.util.Map;

/**
 * A server frame, serialized as {@code {"type": "...", "payload": {...}}}.
 */
public record OutboundEnvelope(String type, Map<String, Object> payload) {
}
