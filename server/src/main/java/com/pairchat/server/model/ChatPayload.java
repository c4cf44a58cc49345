package com.pairchat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotEmpty;

/**
 * Payload of an inbound {@code message}. The id is generated by the client and echoed back
 * in {@code delivered} and {@code seen}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatPayload {
    @NotEmpty
    public String id;

    @NotEmpty
    public String text;
}
