package com.netcourier.rag.service.embedding;

/**
 * Failure of a single call to the embedding provider. A status of 0 means no HTTP response was received.
 */
public class EmbeddingCallException extends RuntimeException {

    private final int statusCode;

    public EmbeddingCallException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public EmbeddingCallException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return statusCode == 0 || statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
