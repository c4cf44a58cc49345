package com.pairchat.server.ws;

import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Four-digit codes in [1000, 9999].
 */
@Component
public class RandomRoomCodeGenerator implements RoomCodeGenerator {
    static final int MIN_CODE = 1000;
    static final int MAX_CODE = 9999;

    @Override
    public String next() {
        return String.valueOf(ThreadLocalRandom.current().nextInt(MIN_CODE, MAX_CODE + 1));
    }
}
