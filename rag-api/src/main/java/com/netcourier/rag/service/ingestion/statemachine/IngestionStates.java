package com.netcourier.rag.service.ingestion.statemachine;

public enum IngestionStates {
    RECEIVED,
    CHUNKED,
    QUEUED,
    EMBEDDING,
    INDEXED,
    FAILED
}
