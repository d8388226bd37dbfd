package com.netcourier.rag.service.ingestion;

import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.springframework.http.HttpStatus;

public class UnsupportedFormatException extends PipelineException {

    public UnsupportedFormatException(String message) {
        super(HttpStatus.UNSUPPORTED_MEDIA_TYPE, PipelineStage.INGESTION, message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(HttpStatus.UNSUPPORTED_MEDIA_TYPE, PipelineStage.INGESTION, message, cause);
    }
}
