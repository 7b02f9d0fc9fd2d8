package com.eainde.council.gateway;

/** Model output that is not JSON, or JSON that breaks the requested contract. */
public class SchemaViolationException extends GatewayException {

    public SchemaViolationException(String message) {
        super(Kind.INVALID_RESPONSE, message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(Kind.INVALID_RESPONSE, message, cause);
    }
}
