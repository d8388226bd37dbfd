package com.netcourier.rag.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Locale;

/**
 * Process-wide pipeline configuration. Bound once at startup from {@code rag.*} and passed to every
 * component; unset values fall back to the defaults applied in the compact constructors.
 */
@ConfigurationProperties(prefix = "rag")
public record RagProperties(Chunking chunking,
                            Embedding embedding,
                            VectorStore vectorStore,
                            Cache cache,
                            Query query,
                            Generation generation,
                            Queue queue,
                            Ingestion ingestion,
                            Storage storage) {

    public RagProperties {
        chunking = chunking == null ? new Chunking(0, null, null) : chunking;
        embedding = embedding == null ? new Embedding(null, 0, 0, 0, null, null, null, 0) : embedding;
        vectorStore = vectorStore == null ? new VectorStore(null, null, null, null) : vectorStore;
        cache = cache == null ? new Cache(null, null, null) : cache;
        query = query == null ? new Query(0, 0, 0, null) : query;
        generation = generation == null ? new Generation(null, null, 0, 0, 0) : generation;
        queue = queue == null ? new Queue(0, 0, null, null) : queue;
        ingestion = ingestion == null ? new Ingestion(null) : ingestion;
        storage = storage == null ? new Storage(null, null) : storage;
    }

    public static RagProperties defaults() {
        return new RagProperties(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Model identity used in cache keys, so a model swap never serves answers produced by another model.
     */
    public String modelVersion() {
        return embedding.model() + "/" + embedding.dimension() + "|" + generation.model();
    }

    public record Chunking(int maxChunkSize, Integer overlap, String locale) {

        public Chunking {
            maxChunkSize = maxChunkSize <= 0 ? 1000 : maxChunkSize;
            overlap = overlap == null || overlap < 0 ? 200 : overlap;
            locale = locale == null ? "" : locale.trim();
        }

        public Locale resolvedLocale() {
            return locale.isEmpty() ? Locale.ROOT : Locale.forLanguageTag(locale);
        }
    }

    public record Embedding(String model,
                            int dimension,
                            int maxBatchSize,
                            int parallelism,
                            Integer maxRetries,
                            Duration initialBackoff,
                            Duration maxBackoff,
                            int maxInputChars) {

        public Embedding {
            model = model == null || model.isBlank() ? "text-embedding-3-small" : model.trim();
            dimension = dimension <= 0 ? 1536 : dimension;
            maxBatchSize = maxBatchSize <= 0 ? 100 : maxBatchSize;
            parallelism = parallelism <= 0 ? 4 : parallelism;
            maxRetries = maxRetries == null || maxRetries < 0 ? 3 : maxRetries;
            initialBackoff = initialBackoff == null ? Duration.ofMillis(500) : initialBackoff;
            maxBackoff = maxBackoff == null ? Duration.ofSeconds(10) : maxBackoff;
            maxInputChars = maxInputChars <= 0 ? 30_000 : maxInputChars;
        }
    }

    public record VectorStore(String backend, String collection, String table, Double minScore) {

        public VectorStore {
            backend = backend == null || backend.isBlank() ? "qdrant" : backend.trim().toLowerCase(Locale.ROOT);
            collection = collection == null || collection.isBlank() ? "rag_chunks" : collection.trim();
            table = table == null || table.isBlank() ? "rag_embeddings" : table.trim();
            minScore = minScore == null ? 0.0 : minScore;
        }
    }

    public record Cache(String backend, Duration ttl, Boolean enabled) {

        public Cache {
            backend = backend == null || backend.isBlank() ? "memory" : backend.trim().toLowerCase(Locale.ROOT);
            ttl = ttl == null || ttl.isZero() || ttl.isNegative() ? Duration.ofHours(1) : ttl;
            enabled = enabled == null || enabled;
        }
    }

    public record Query(int defaultTopK, int maxTopK, int maxQueryLength, Duration timeout) {

        public Query {
            defaultTopK = defaultTopK <= 0 ? 5 : defaultTopK;
            maxTopK = maxTopK <= 0 ? 50 : maxTopK;
            maxQueryLength = maxQueryLength <= 0 ? 1000 : maxQueryLength;
            timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(30) : timeout;
        }
    }

    public record Generation(String model, Double temperature, int maxOutputTokens, int contextTokenBudget, int maxAttempts) {

        public Generation {
            model = model == null || model.isBlank() ? "gpt-4o-mini" : model.trim();
            temperature = temperature == null ? 0.3 : temperature;
            maxOutputTokens = maxOutputTokens <= 0 ? 500 : maxOutputTokens;
            contextTokenBudget = contextTokenBudget <= 0 ? 3000 : contextTokenBudget;
            maxAttempts = maxAttempts <= 0 ? 2 : maxAttempts;
        }
    }

    public record Queue(int maxReceiveCount, int batchSize, Duration throttlePause, Duration visibilityTimeout) {

        public Queue {
            maxReceiveCount = maxReceiveCount <= 0 ? 3 : maxReceiveCount;
            batchSize = batchSize <= 0 ? 16 : batchSize;
            throttlePause = throttlePause == null || throttlePause.isNegative() ? Duration.ofSeconds(30) : throttlePause;
            visibilityTimeout = visibilityTimeout == null || visibilityTimeout.isNegative() || visibilityTimeout.isZero()
                    ? Duration.ofMinutes(5) : visibilityTimeout;
        }
    }

    public record Ingestion(String keyPrefix) {

        public Ingestion {
            keyPrefix = keyPrefix == null ? "uploads/" : keyPrefix;
        }
    }

    public record Storage(String root, String defaultBucket) {

        public Storage {
            root = root == null || root.isBlank() ? "./data/objects" : root.trim();
            defaultBucket = defaultBucket == null || defaultBucket.isBlank() ? "rag-documents" : defaultBucket.trim();
        }
    }
}
