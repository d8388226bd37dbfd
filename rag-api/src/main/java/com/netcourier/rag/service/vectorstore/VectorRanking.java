package com.netcourier.rag.service.vectorstore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Result ordering shared by every backend: score descending, ties broken by chunk id ascending.
 */
public final class VectorRanking {

    public static final Comparator<VectorMatch> ORDER = Comparator
            .comparingDouble(VectorMatch::score).reversed()
            .thenComparing(VectorMatch::chunkId);

    private VectorRanking() {
    }

    public static List<VectorMatch> rank(List<VectorMatch> matches, int topK, double minScore) {
        return matches.stream()
                .filter(match -> match.score() >= minScore)
                .sorted(ORDER)
                .limit(topK)
                .toList();
    }

    public static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    static boolean matchesFilters(Map<String, String> payload, Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        return filters.entrySet().stream()
                .allMatch(filter -> filter.getValue().equals(payload.get(filter.getKey())));
    }
}
