package com.pairchat.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pairchat.server.model.OutboundEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Collection;

/**
 * Best-effort delivery of server envelopes. Closed sessions are skipped and send failures are
 * logged, so a socket closing mid-broadcast never breaks the loop over the other members.
 */
@Component
public class EnvelopeSender {
    private static final Logger log = LoggerFactory.getLogger(EnvelopeSender.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public void send(WebSocketSession session, OutboundEnvelope envelope) {
        deliver(session, encode(envelope));
    }

    /** Sends to every member of {@code targets}. */
    public int broadcast(Collection<WebSocketSession> targets, OutboundEnvelope envelope) {
        return broadcastExcept(targets, envelope, null);
    }

    /** Sends to every member of {@code targets} except {@code excluded}. */
    public int broadcastExcept(Collection<WebSocketSession> targets, OutboundEnvelope envelope,
                               WebSocketSession excluded) {
        TextMessage frame = encode(envelope);
        int ok = 0;
        for (WebSocketSession ws : targets) {
            if (ws == excluded) continue;
            if (deliver(ws, frame)) ok++;
        }
        log.debug("[BROADCAST] type={} targets={} delivered={}", envelope.type(), targets.size(), ok);
        return ok;
    }

    private boolean deliver(WebSocketSession ws, TextMessage frame) {
        if (!ws.isOpen()) {
            log.debug("[SKIP] session={} closed", ws.getId());
            return false;
        }
        try {
            ws.sendMessage(frame);
            return true;
        } catch (IOException | SessionLimitExceededException | IllegalStateException e) {
            log.warn("[WARN] send fail session={} {}", ws.getId(), e.getMessage());
            return false;
        }
    }

    private TextMessage encode(OutboundEnvelope envelope) {
        try {
            return new TextMessage(mapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode envelope type=" + envelope.type(), e);
        }
    }
}
