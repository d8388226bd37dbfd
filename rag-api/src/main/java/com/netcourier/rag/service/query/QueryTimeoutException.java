package com.netcourier.rag.service.query;

import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.springframework.http.HttpStatus;

public class QueryTimeoutException extends PipelineException {

    public QueryTimeoutException(String message) {
        super(HttpStatus.GATEWAY_TIMEOUT, PipelineStage.QUERY, message);
    }
}
