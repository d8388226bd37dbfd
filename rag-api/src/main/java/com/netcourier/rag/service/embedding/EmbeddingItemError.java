package com.netcourier.rag.service.embedding;

public record EmbeddingItemError(int index, String reason) {
}
