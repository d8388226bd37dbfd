package com.netcourier.rag.service.embedding;

import reactor.core.publisher.Mono;

import java.util.List;

public interface EmbeddingClient {

    /**
     * Embeds every text in one remote call; the returned vectors follow the input order.
     */
    Mono<List<float[]>> embed(List<String> texts);

    String modelName();
}
