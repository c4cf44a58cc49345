package com.pairchat.server.ws;

/**
 * Source of candidate room codes. Candidates may repeat; {@link RoomTable} retries until it
 * finds one that is not held by an open room.
 */
@FunctionalInterface
public interface RoomCodeGenerator {
    String next();
}
