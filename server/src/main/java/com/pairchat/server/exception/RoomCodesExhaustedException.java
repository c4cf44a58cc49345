package com.pairchat.server.exception;

/**
 * No free room code was found within the configured number of attempts.
 */
public class RoomCodesExhaustedException extends RelayException {
    private final int attempts;

    public RoomCodesExhaustedException(int attempts) {
        super("Unable to create room");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
