package com.netcourier.rag.service;

import org.springframework.http.HttpStatus;

public class PipelineException extends RuntimeException {

    private final HttpStatus status;
    private final PipelineStage stage;
    private final boolean retryable;

    public PipelineException(HttpStatus status, PipelineStage stage, String message) {
        this(status, stage, false, message, null);
    }

    public PipelineException(HttpStatus status, PipelineStage stage, String message, Throwable cause) {
        this(status, stage, false, message, cause);
    }

    protected PipelineException(HttpStatus status, PipelineStage stage, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.stage = stage;
        this.retryable = retryable;
    }

    public HttpStatus status() {
        return status;
    }

    public PipelineStage stage() {
        return stage;
    }

    public boolean retryable() {
        return retryable;
    }
}
