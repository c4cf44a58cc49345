package com.pairchat.server.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mockito-backed sessions that record every text frame sent to them.
 */
final class MockSessions {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<WebSocketSession, List<JsonNode>> frames = new HashMap<>();
    private final Map<WebSocketSession, AtomicBoolean> open = new HashMap<>();
    private final Map<WebSocketSession, List<Boolean>> lockHeld = new HashMap<>();
    private volatile Object watchedLock;

    /** Record, for every frame sent from now on, whether the sending thread held {@code lock}. */
    void watch(Object lock) {
        this.watchedLock = lock;
    }

    WebSocketSession open(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        List<JsonNode> received = new ArrayList<>();
        List<Boolean> held = new ArrayList<>();
        AtomicBoolean isOpen = new AtomicBoolean(true);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenAnswer(inv -> isOpen.get());
        try {
            doAnswer(inv -> {
                TextMessage msg = inv.getArgument(0);
                received.add(MAPPER.readTree(msg.getPayload()));
                Object lock = watchedLock;
                held.add(lock != null && Thread.holdsLock(lock));
                return null;
            }).when(session).sendMessage(any());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        frames.put(session, received);
        open.put(session, isOpen);
        lockHeld.put(session, held);
        return session;
    }

    void markClosed(WebSocketSession session) {
        open.get(session).set(false);
    }

    List<JsonNode> received(WebSocketSession session) {
        return frames.get(session);
    }

    List<JsonNode> drain(WebSocketSession session) {
        List<JsonNode> copy = new ArrayList<>(frames.get(session));
        frames.get(session).clear();
        lockHeld.get(session).clear();
        return copy;
    }

    /** Parallel to {@link #received}: whether the watched lock was held for each frame. */
    List<Boolean> lockHeld(WebSocketSession session) {
        return lockHeld.get(session);
    }

    static TextMessage frame(String json) {
        return new TextMessage(json);
    }
}
