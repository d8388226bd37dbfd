package com.netcourier.rag.service.embedding;

public record EmbeddingVector(String id, float[] vector, String modelName, int dimension) {
}
