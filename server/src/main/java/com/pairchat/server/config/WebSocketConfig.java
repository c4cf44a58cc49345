package com.pairchat.server.config;

import com.pairchat.server.ws.ChatHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Plain WebSocket endpoint (no STOMP, no SockJS); clients speak the JSON envelope protocol directly.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final ChatHandler chatHandler;

    @Value("${relay.endpoint:/}")
    private String endpoint;

    @Value("${relay.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(ChatHandler chatHandler) {
        this.chatHandler = chatHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatHandler, endpoint)
                .setAllowedOrigins(allowedOrigins);
        log.info("[BOOT] relay endpoint={} origins={}", endpoint, String.join(",", allowedOrigins));
    }
}
