package com.pairchat.client;

public record ClientConfig(
        String relayUrl,        // ws://localhost:8080/
        long reconnectDelayMs   // fixed delay before reopening a dropped socket
) {
    public static final String DEFAULT_URL = "ws://localhost:8080/";
    public static final long DEFAULT_RECONNECT_MS = 2000L;

    /** args / env / default, in that order. */
    public static ClientConfig fromArgs(String[] args) {
        String url = args.length > 0 ? args[0] : envOr("RELAY_URL", DEFAULT_URL);
        long delay = args.length > 1 ? Long.parseLong(args[1])
                : Long.parseLong(envOr("RELAY_RECONNECT_MS", String.valueOf(DEFAULT_RECONNECT_MS)));
        return new ClientConfig(url, delay);
    }

    private static String envOr(String key, String defVal) {
        String env = System.getenv(key);
        return env != null && !env.isBlank() ? env.trim() : defVal;
    }
}
