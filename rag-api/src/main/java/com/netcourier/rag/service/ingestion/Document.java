package com.netcourier.rag.service.ingestion;

public record Document(String documentId,
                       String sourceUri,
                       String contentType,
                       String rawText,
                       int version) {
}
