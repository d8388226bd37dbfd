package com.netcourier.rag.model;

public record SourceReference(String chunkId, String documentId, double score) {
}
