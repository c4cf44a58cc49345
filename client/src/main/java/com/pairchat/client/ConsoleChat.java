package com.pairchat.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Line-based chat against the relay.
 * <pre>
 *   /create          open a new room
 *   /join 4821       join an existing room
 *   /typing on|off   typing indicator
 *   /quit            leave
 *   anything else    send as a message
 * </pre>
 */
public class ConsoleChat implements RelayListener {
    private static final Logger log = LoggerFactory.getLogger(ConsoleChat.class);

    private final PrintStream out;
    private RelayClient client;

    ConsoleChat(PrintStream out) {
        this.out = out;
    }

    void attach(RelayClient client) {
        this.client = client;
    }

    public static void main(String[] args) {
        ClientConfig cfg = ClientConfig.fromArgs(args);
        ConsoleChat console = new ConsoleChat(System.out);
        RelayClient client = new RelayClient(cfg, console);
        console.attach(client);
        client.connect();
        log.info("[CONF] url={} reconnectDelayMs={}", cfg.relayUrl(), cfg.reconnectDelayMs());

        try (client; BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (!console.handleLine(line)) break;
            }
        } catch (Exception e) {
            log.error("Fatal error in ConsoleChat.main", e);
            System.exit(1);
        }
    }

    /** @return false once the user asked to quit */
    boolean handleLine(String line) {
        String cmd = line.trim();
        if (cmd.isEmpty()) return true;

        if (cmd.equals("/quit")) return false;
        if (cmd.equals("/create")) {
            report(client.createRoom());
        } else if (cmd.startsWith("/join")) {
            String room = cmd.substring("/join".length()).trim();
            if (room.isEmpty()) out.println("usage: /join <room>");
            else report(client.joinRoom(room));
        } else if (cmd.startsWith("/typing")) {
            report(client.typing(cmd.endsWith("on")));
        } else {
            report(client.sendMessage(line).isPresent());
        }
        return true;
    }

    private void report(boolean sent) {
        if (!sent) out.println("! not connected");
    }

    @Override
    public void onConnected() {
        out.println("* connected");
    }

    @Override
    public void onDisconnected() {
        out.println("* disconnected, reconnecting...");
    }

    @Override
    public void onEvent(ServerEvent event) {
        switch (event.type()) {
            case "room-created" -> out.println("* room " + event.text("room") + " created");
            case "joined" -> out.println("* joined room " + event.text("room"));
            case "user-count" -> out.println("* users " + event.number("count") + "/" + event.number("max"));
            case "typing" -> out.println(event.flag("typing") ? "* peer is typing..." : "* peer stopped typing");
            case "message" -> {
                out.println("> " + event.text("message"));
                client.seen(event.text("id"));
            }
            case "delivered" -> out.println("  (delivered " + event.text("id") + ")");
            case "seen" -> out.println("  (seen " + event.text("id") + ")");
            case "error" -> out.println("! " + event.text("message"));
            default -> log.debug("[IGNORE] type={}", event.type());
        }
    }
}
