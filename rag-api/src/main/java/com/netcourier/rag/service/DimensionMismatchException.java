package com.netcourier.rag.service;

import org.springframework.http.HttpStatus;

/**
 * A vector whose length differs from the configured embedding dimension. Never retried.
 */
public class DimensionMismatchException extends PipelineException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(PipelineStage stage, int expected, int actual) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, stage,
                "Vector dimension " + actual + " does not match configured dimension " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
