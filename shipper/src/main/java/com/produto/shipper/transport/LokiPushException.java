package com.produto.shipper.transport;

import lombok.Getter;

/**
 * Raised when a batch could not be delivered to Loki.
 */
@Getter
public class LokiPushException extends RuntimeException {

    /**
     * HTTP status returned by Loki, or -1 when no response was received.
     */
    private final int statusCode;

    public LokiPushException(int statusCode, String responseBody) {
        super("Loki returned status " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
    }

    public LokiPushException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }
}
