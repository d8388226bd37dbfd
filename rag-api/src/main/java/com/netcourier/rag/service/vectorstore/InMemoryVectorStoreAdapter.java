package com.netcourier.rag.service.vectorstore;

import com.netcourier.rag.config.RagProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "rag.vector-store", name = "backend", havingValue = "memory")
public class InMemoryVectorStoreAdapter implements VectorStoreAdapter {

    private final Map<String, VectorRecord> records = new ConcurrentHashMap<>();
    private final int dimension;
    private final double minScore;

    @Autowired
    public InMemoryVectorStoreAdapter(RagProperties properties) {
        this(properties.embedding().dimension(), properties.vectorStore().minScore());
    }

    public InMemoryVectorStoreAdapter(int dimension, double minScore) {
        this.dimension = dimension;
        this.minScore = minScore;
    }

    @Override
    public void upsert(List<VectorRecord> batch) {
        batch.forEach(record -> VectorStoreAdapter.requireDimension(dimension, record.vector()));
        batch.forEach(record -> records.put(record.id(), record));
    }

    @Override
    public List<VectorMatch> search(float[] query, int topK, Map<String, String> filters) {
        VectorStoreAdapter.requireDimension(dimension, query);
        List<VectorMatch> matches = records.values().stream()
                .filter(record -> VectorRanking.matchesFilters(record.payload(), filters))
                .map(record -> new VectorMatch(record.id(), VectorRanking.cosine(query, record.vector()), record.payload()))
                .toList();
        return VectorRanking.rank(matches, topK, minScore);
    }

    @Override
    public int delete(Collection<String> ids) {
        int removed = 0;
        for (String id : ids) {
            if (records.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public VectorStoreStats stats() {
        return new VectorStoreStats("memory", similarityMetric(), records.size(), dimension);
    }
}
