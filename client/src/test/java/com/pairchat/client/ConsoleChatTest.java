package com.pairchat.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleChatTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ByteArrayOutputStream buffer;
    private ConsoleChat console;
    private RelayClient client;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        console = new ConsoleChat(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        // never connected: every send reports "not connected"
        client = new RelayClient(new ClientConfig("ws://localhost:1/", 50), console);
        console.attach(client);
    }

    @Test
    void rendersServerEvents() throws Exception {
        console.onEvent(event("{\"type\":\"room-created\",\"payload\":{\"room\":\"4821\"}}"));
        console.onEvent(event("{\"type\":\"user-count\",\"payload\":{\"count\":1,\"max\":2}}"));
        console.onEvent(event("{\"type\":\"error\",\"payload\":{\"message\":\"Room is full\"}}"));
        console.onEvent(event("{\"type\":\"message\",\"payload\":{\"id\":\"m1\",\"message\":\"hi\"}}"));

        String out = output();
        assertTrue(out.contains("* room 4821 created"), out);
        assertTrue(out.contains("* users 1/2"), out);
        assertTrue(out.contains("! Room is full"), out);
        assertTrue(out.contains("> hi"), out);
    }

    @Test
    void commandsAreParsed() {
        assertTrue(console.handleLine("/create"));
        assertTrue(console.handleLine("/join"));
        assertTrue(console.handleLine("   "));
        assertFalse(console.handleLine("/quit"));

        String out = output();
        assertTrue(out.contains("! not connected"), out);
        assertTrue(out.contains("usage: /join <room>"), out);
    }

    private String output() {
        client.close();
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static ServerEvent event(String json) throws Exception {
        var tree = MAPPER.readTree(json);
        return new ServerEvent(tree.get("type").asText(), tree.get("payload"));
    }
}
