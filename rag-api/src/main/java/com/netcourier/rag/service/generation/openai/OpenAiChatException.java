package com.netcourier.rag.service.generation.openai;

/**
 * Failed chat completion call. A status of 0 means the provider never answered (timeout or connection error).
 */
public class OpenAiChatException extends RuntimeException {

    private final int statusCode;

    public OpenAiChatException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Rate limits, timeouts and server errors may succeed on another attempt; other 4xx answers will not.
     */
    public boolean isTransient() {
        return statusCode == 0 || statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
