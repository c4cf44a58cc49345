package com.pairchat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotEmpty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class JoinRoomPayload {
    @NotEmpty
    public String room;
}
