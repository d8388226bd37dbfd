package com.netcourier.rag.controller;

import com.netcourier.rag.service.vectorstore.VectorStoreAdapter;
import com.netcourier.rag.service.vectorstore.VectorStoreStats;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class VectorStoreController {

    private final VectorStoreAdapter vectorStore;

    public VectorStoreController(VectorStoreAdapter vectorStore) {
        this.vectorStore = vectorStore;
    }

    @GetMapping(path = "/vector-store/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<VectorStoreStats> stats() {
        return Mono.fromCallable(vectorStore::stats)
                .subscribeOn(Schedulers.boundedElastic());
    }
}
