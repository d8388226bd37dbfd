package com.netcourier.rag.service.generation;

public record ContextPassage(String chunkId, String documentId, String text, double score) {
}
