package com.netcourier.rag.service;

public enum PipelineStage {
    INGESTION,
    EMBEDDING,
    RETRIEVAL,
    GENERATION,
    QUERY
}
