package com.netcourier.rag.service.ingestion.statemachine;

public enum IngestionEvents {
    CHUNK,
    ENQUEUE,
    EMBED,
    COMPLETE,
    FAIL,
    RETRY
}
