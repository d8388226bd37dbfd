package com.netcourier.rag.service.vectorstore;

public record VectorStoreStats(String backend, String metric, long totalVectors, int dimension) {
}
