package com.netcourier.rag.service.embedding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Positional outcome of a batch embedding call: {@code vectors().get(i)} belongs to input {@code i} and is
 * {@code null} when that input failed, in which case {@code errors()} holds an entry for index {@code i}.
 */
public record EmbeddingResult(List<float[]> vectors, List<EmbeddingItemError> errors, String modelName) {

    public EmbeddingResult {
        vectors = Collections.unmodifiableList(new ArrayList<>(vectors));
        List<EmbeddingItemError> sorted = new ArrayList<>(errors);
        sorted.sort(Comparator.comparingInt(EmbeddingItemError::index));
        errors = List.copyOf(sorted);
    }

    public int size() {
        return vectors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public long successCount() {
        return vectors.stream().filter(Objects::nonNull).count();
    }
}
