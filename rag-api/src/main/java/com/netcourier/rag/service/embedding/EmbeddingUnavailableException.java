package com.netcourier.rag.service.embedding;

import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.springframework.http.HttpStatus;

import java.util.List;

public class EmbeddingUnavailableException extends PipelineException {

    private final List<String> batch;

    public EmbeddingUnavailableException(List<String> batch, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, PipelineStage.EMBEDDING, true,
                "Embedding provider unavailable after retries", cause);
        this.batch = batch == null ? List.of() : List.copyOf(batch);
    }

    public List<String> batch() {
        return batch;
    }
}
