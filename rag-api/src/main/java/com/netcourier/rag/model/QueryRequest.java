package com.netcourier.rag.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record QueryRequest(@NotBlank @Size(max = 1000) String query,
                           @Min(1) @Max(50) Integer topK,
                           Map<String, String> filters) {

    public QueryRequest {
        filters = filters == null ? Map.of() : Map.copyOf(filters);
    }

    public QueryRequest(String query) {
        this(query, null, null);
    }
}
