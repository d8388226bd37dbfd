package com.netcourier.rag.service.vectorstore;

import java.util.Map;

/**
 * A vector keyed by chunk id. Payload values are strings so every backend can filter on them the same way.
 */
public record VectorRecord(String id, float[] vector, Map<String, String> payload) {

    public static final String DOCUMENT_ID = "document_id";
    public static final String VERSION = "version";
    public static final String SEQUENCE_INDEX = "sequence_index";
    public static final String TEXT = "text";
    public static final String SOURCE_URI = "source_uri";

    public VectorRecord {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public String documentId() {
        return payload.get(DOCUMENT_ID);
    }
}
