package com.netcourier.rag.service.generation;

import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.springframework.http.HttpStatus;

/**
 * The model could not produce an answer. {@link #retryable()} is false when the provider rejected the request
 * itself, so asking again would only repeat the rejection.
 */
public class GenerationFailureException extends PipelineException {

    public GenerationFailureException(String message) {
        this(message, null, true);
    }

    public GenerationFailureException(String message, Throwable cause, boolean retryable) {
        super(HttpStatus.BAD_GATEWAY, PipelineStage.GENERATION, retryable, message, cause);
    }
}
