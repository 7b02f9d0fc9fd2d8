package com.eainde.council.gateway;

/**
 * Failure of a single inference call. Callers treat every kind the same way (retry once, then degrade);
 * the kind is kept for logs and for the degraded rationale.
 */
public class GatewayException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        RATE_LIMITED,
        INVALID_RESPONSE,
        UNAVAILABLE
    }

    private final Kind kind;

    public GatewayException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
