package com.codesmith.orchestrator.client;

/**
 * Thrown when a model, validation or memory service returns an error or is
 * unreachable. The orchestrator turns it into a failed attempt.
 */
public class ClientException extends RuntimeException {

    private final int statusCode;

    public ClientException(String message) {
        this(message, -1);
    }

    public ClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 if no response arrived. */
    public int statusCode() { return statusCode; }
}
