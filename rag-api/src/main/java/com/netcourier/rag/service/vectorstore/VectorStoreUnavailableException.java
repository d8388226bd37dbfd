package com.netcourier.rag.service.vectorstore;

import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.springframework.http.HttpStatus;

public class VectorStoreUnavailableException extends PipelineException {

    public VectorStoreUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, PipelineStage.RETRIEVAL, true, message, cause);
    }
}
