package com.pairchat.server.exception;

/**
 * Base for failures that are reported back to the offending connection as an
 * {@code error} envelope. The exception message is the user-facing text.
 */
public abstract class RelayException extends RuntimeException {
    protected RelayException(String message) {
        super(message);
    }
}
