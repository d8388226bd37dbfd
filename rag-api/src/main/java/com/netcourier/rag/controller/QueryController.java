package com.netcourier.rag.controller;

import com.netcourier.rag.model.QueryRequest;
import com.netcourier.rag.model.QueryResponse;
import com.netcourier.rag.service.query.QueryOrchestrator;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class QueryController {

    private final QueryOrchestrator queryOrchestrator;

    public QueryController(QueryOrchestrator queryOrchestrator) {
        this.queryOrchestrator = queryOrchestrator;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        return Mono.fromCallable(() -> queryOrchestrator.answer(request))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
