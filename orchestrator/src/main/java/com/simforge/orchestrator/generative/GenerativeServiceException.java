package com.simforge.orchestrator.generative;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Thrown when the generative service cannot produce structured output.
 *
 * {@code statusCode} is -1 when no HTTP response was received.
 */
public class GenerativeServiceException extends RuntimeException {

    private final int statusCode;

    public GenerativeServiceException(int statusCode, String body) {
        super("Generative service error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    public GenerativeServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() { return statusCode; }

    /** True if the call failed because a network deadline expired. */
    public boolean timedOut() {
        for (Throwable t = getCause(); t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return statusCode == 408 || statusCode == 504;
    }
}
