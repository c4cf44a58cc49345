package com.pairchat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A client frame: {@code {"type": "...", "payload": {...}}}. The payload stays untyped
 * until the dispatcher knows which kind it is dealing with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundEnvelope {
    public String type;

    public JsonNode payload;
}
