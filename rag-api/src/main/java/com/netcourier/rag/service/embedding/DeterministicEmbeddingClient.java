package com.netcourier.rag.service.embedding;

import com.netcourier.rag.config.RagProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Offline embedder for local runs and tests: hashes lower-cased word tokens into a fixed number of
 * buckets and L2-normalises the counts, so texts sharing vocabulary score close under cosine similarity.
 */
@Component
@ConditionalOnProperty(prefix = "rag.embedding", name = "provider", havingValue = "deterministic")
public class DeterministicEmbeddingClient implements EmbeddingClient {

    private final int dimension;

    @Autowired
    public DeterministicEmbeddingClient(RagProperties properties) {
        this(properties.embedding().dimension());
    }

    public DeterministicEmbeddingClient(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public Mono<List<float[]>> embed(List<String> texts) {
        return Mono.fromSupplier(() -> texts.stream().map(this::vectorFor).toList());
    }

    @Override
    public String modelName() {
        return "deterministic-hash";
    }

    float[] vectorFor(String text) {
        float[] vector = new float[dimension];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        boolean any = false;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            vector[bucket(token)] += 1f;
            any = true;
        }
        if (!any) {
            vector[bucket(text)] = 1f;
        }
        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }

    private int bucket(String token) {
        CRC32 crc = new CRC32();
        crc.update(token.getBytes(StandardCharsets.UTF_8));
        return (int) (crc.getValue() % dimension);
    }
}
