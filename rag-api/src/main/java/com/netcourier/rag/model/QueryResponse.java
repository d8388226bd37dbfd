package com.netcourier.rag.model;

import java.util.List;

public record QueryResponse(String answer,
                            List<SourceReference> sources,
                            boolean cacheHit,
                            boolean unsupportedByContext,
                            boolean generationFailed) {

    public QueryResponse {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
