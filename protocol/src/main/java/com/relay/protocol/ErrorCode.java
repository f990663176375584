package com.relay.protocol;

/**
 * Failure taxonomy shared by broker operations and wire error responses.
 * The enum name is what travels as {@code error.code}.
 */
public enum ErrorCode {
    NOT_FOUND            (false),
    INVALID_STATE        (false),
    CAPACITY_EXCEEDED    (false),
    CONNECTION_NOT_ALIVE (false),
    SEND_FAILURE         (false),
    TIMEOUT              (false),
    NO_TARGET_AVAILABLE  (false),
    // Message was stored for later delivery; caller may retry or wait for reconnect
    CLIENT_QUEUED        (true),
    BAD_REQUEST          (false),
    INTERNAL             (false);

    public final boolean retryable;

    ErrorCode(boolean retryable) { this.retryable = retryable; }

    public static ErrorCode fromName(String name) {
        if (name == null) return INTERNAL;
        try {
            return valueOf(name);
        } catch (IllegalArgumentException e) {
            return INTERNAL;
        }
    }
}
