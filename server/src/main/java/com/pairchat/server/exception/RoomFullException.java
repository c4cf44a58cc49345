package com.pairchat.server.exception;

public class RoomFullException extends RelayException {
    public static final String MESSAGE = "Room is full";

    private final String room;

    public RoomFullException(String room) {
        super(MESSAGE);
        this.room = room;
    }

    public String getRoom() {
        return room;
    }
}
