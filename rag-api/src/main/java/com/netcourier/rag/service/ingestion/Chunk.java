package com.netcourier.rag.service.ingestion;

public record Chunk(String chunkId,
                   String documentId,
                   int version,
                   int sequenceIndex,
                   String text,
                   int charStart,
                   int charEnd,
                   String contentHash) {
}
