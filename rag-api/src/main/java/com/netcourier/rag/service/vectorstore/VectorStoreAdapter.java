package com.netcourier.rag.service.vectorstore;

import com.netcourier.rag.service.DimensionMismatchException;
import com.netcourier.rag.service.PipelineStage;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Storage of chunk vectors with similarity search. Every implementation scores by cosine similarity and
 * orders results with {@link VectorRanking#ORDER}.
 */
public interface VectorStoreAdapter {

    String COSINE = "cosine";

    /**
     * Inserts or overwrites by id. The dimension of every record is checked before anything is sent.
     */
    void upsert(List<VectorRecord> records);

    List<VectorMatch> search(float[] query, int topK, Map<String, String> filters);

    int delete(Collection<String> ids);

    VectorStoreStats stats();

    default String similarityMetric() {
        return COSINE;
    }

    static void requireDimension(int expected, float[] vector) {
        if (vector == null || vector.length != expected) {
            throw new DimensionMismatchException(PipelineStage.RETRIEVAL, expected, vector == null ? 0 : vector.length);
        }
    }
}
