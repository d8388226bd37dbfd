package com.netcourier.rag.service.vectorstore;

import java.util.Map;

public record VectorMatch(String chunkId, double score, Map<String, String> payload) {

    public VectorMatch {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public String documentId() {
        return payload.get(VectorRecord.DOCUMENT_ID);
    }

    public String text() {
        return payload.getOrDefault(VectorRecord.TEXT, "");
    }
}
