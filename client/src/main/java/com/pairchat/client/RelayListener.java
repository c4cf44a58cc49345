package com.pairchat.client;

/**
 * Callbacks from {@link RelayClient}; all run on OkHttp's reader thread.
 */
public interface RelayListener {
    default void onConnected() {}

    void onEvent(ServerEvent event);

    /** The socket is gone; a reconnect is already scheduled unless the client was closed. */
    default void onDisconnected() {}
}
