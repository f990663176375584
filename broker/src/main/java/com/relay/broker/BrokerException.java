package com.relay.broker;

import com.relay.protocol.ErrorCode;

/**
 * Failure of a broker operation. Carries the {@link ErrorCode} that is reported
 * to callers and, for client-facing operations, sent back on the wire.
 */
public class BrokerException extends RuntimeException {

    private final ErrorCode code;

    public BrokerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BrokerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() { return code; }

    public boolean isRetryable() { return code.retryable; }

    /** Extracts the error code of any failure; non-broker failures map to INTERNAL. */
    public static ErrorCode codeOf(Throwable t) {
        Throwable c = t;
        while (c != null) {
            if (c instanceof BrokerException be) return be.code;
            c = c.getCause();
        }
        return ErrorCode.INTERNAL;
    }
}
