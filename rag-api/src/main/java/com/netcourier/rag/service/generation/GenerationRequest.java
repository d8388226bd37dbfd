package com.netcourier.rag.service.generation;

import java.util.List;

public record GenerationRequest(String question, List<ContextPassage> context) {

    public GenerationRequest {
        context = context == null ? List.of() : List.copyOf(context);
    }
}
