package com.pairchat.server.exception;

public class RoomNotFoundException extends RelayException {
    public static final String MESSAGE = "Room does not exist";

    private final String room;

    public RoomNotFoundException(String room) {
        super(MESSAGE);
        this.room = room;
    }

    public String getRoom() {
        return room;
    }
}
