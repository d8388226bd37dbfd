package com.netcourier.rag.service.vectorstore;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Managed vector index backed by a Qdrant collection created with cosine distance.
 */
@Component
@ConditionalOnProperty(prefix = "rag.vector-store", name = "backend", havingValue = "qdrant", matchIfMissing = true)
public class QdrantVectorStoreAdapter implements VectorStoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStoreAdapter.class);

    private final WebClient qdrantWebClient;
    private final String collection;
    private final int dimension;
    private final double minScore;
    private final Duration timeout;
    private volatile boolean collectionReady;

    public QdrantVectorStoreAdapter(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                                    RagProperties properties,
                                    @Value("${rag.vector-store.qdrant.timeout-seconds:10}") long timeoutSeconds) {
        this.qdrantWebClient = qdrantWebClient;
        this.collection = properties.vectorStore().collection();
        this.dimension = properties.embedding().dimension();
        this.minScore = properties.vectorStore().minScore();
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public void upsert(List<VectorRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        records.forEach(record -> VectorStoreAdapter.requireDimension(dimension, record.vector()));
        ensureCollection();
        List<Point> points = records.stream()
                .map(record -> new Point(record.id(), record.vector(), record.payload()))
                .toList();
        call("upsert", qdrantWebClient.put()
                .uri("/collections/{collection}/points?wait=true", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new UpsertRequest(points))
                .retrieve()
                .bodyToMono(Void.class));
        log.debug("Upserted {} point(s) into {}", points.size(), collection);
    }

    @Override
    public List<VectorMatch> search(float[] query, int topK, Map<String, String> filters) {
        VectorStoreAdapter.requireDimension(dimension, query);
        ensureCollection();
        SearchRequest request = new SearchRequest(query, candidateLimit(topK), true, buildFilter(filters),
                minScore > 0 ? minScore : null);
        SearchResponse response = call("search", qdrantWebClient.post()
                .uri("/collections/{collection}/points/search", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(SearchResponse.class));
        if (response == null || response.result() == null) {
            return List.of();
        }
        List<VectorMatch> matches = response.result().stream()
                .map(ScoredPoint::toMatch)
                .toList();
        return VectorRanking.rank(matches, topK, minScore);
    }

    /**
     * Returns how many of the ids were stored. Qdrant's delete reply carries no count, so the ids are
     * looked up first and only the ones found are deleted.
     */
    @Override
    public int delete(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        RetrieveResponse found = call("retrieve", qdrantWebClient.post()
                .uri("/collections/{collection}/points", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RetrieveRequest(List.copyOf(ids), false, false))
                .retrieve()
                .bodyToMono(RetrieveResponse.class));
        List<String> existing = found == null || found.result() == null
                ? List.of()
                : found.result().stream().map(point -> String.valueOf(point.id())).toList();
        if (existing.isEmpty()) {
            return 0;
        }
        call("delete", qdrantWebClient.post()
                .uri("/collections/{collection}/points/delete?wait=true", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new DeleteRequest(existing))
                .retrieve()
                .bodyToMono(Void.class));
        return existing.size();
    }

    @Override
    public VectorStoreStats stats() {
        CollectionResponse response = call("stats", qdrantWebClient.get()
                .uri("/collections/{collection}", collection)
                .retrieve()
                .bodyToMono(CollectionResponse.class));
        long points = response == null || response.result() == null || response.result().pointsCount() == null
                ? 0 : response.result().pointsCount();
        return new VectorStoreStats("qdrant", similarityMetric(), points, dimension);
    }

    /**
     * Qdrant breaks score ties in its own order, so equal scores at the top-k cutoff could drop the point
     * that sorts first by chunk id. Fetching twice as many candidates and ranking locally keeps the cut
     * deterministic unless more than {@code topK} extra points share the cutoff score.
     */
    static int candidateLimit(int topK) {
        return topK * 2;
    }

    private synchronized void ensureCollection() {
        if (collectionReady) {
            return;
        }
        boolean exists;
        try {
            qdrantWebClient.get()
                    .uri("/collections/{collection}", collection)
                    .retrieve()
                    .bodyToMono(Void.class)
                    .timeout(timeout)
                    .block();
            exists = true;
        } catch (WebClientResponseException.NotFound notFound) {
            exists = false;
        } catch (RuntimeException e) {
            throw translate("collection lookup", e);
        }
        if (!exists) {
            log.info("Creating Qdrant collection {} (size {}, cosine distance)", collection, dimension);
            call("create collection", qdrantWebClient.put()
                    .uri("/collections/{collection}", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new CreateCollectionRequest(new VectorParams(dimension, "Cosine")))
                    .retrieve()
                    .bodyToMono(Void.class));
        }
        collectionReady = true;
    }

    private <T> T call(String operation, Mono<T> request) {
        try {
            return request.timeout(timeout).block();
        } catch (RuntimeException e) {
            throw translate(operation, e);
        }
    }

    private RuntimeException translate(String operation, RuntimeException error) {
        Throwable cause = error.getCause() instanceof TimeoutException ? error.getCause() : error;
        if (cause instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            log.warn("Qdrant {} returned {}: {}", operation, status, response.getResponseBodyAsString());
            if (status == 401 || status == 403 || status == 429 || status >= 500) {
                return new VectorStoreUnavailableException("Qdrant " + operation + " failed with status " + status, response);
            }
            return new PipelineException(HttpStatus.BAD_GATEWAY, PipelineStage.RETRIEVAL,
                    "Qdrant rejected " + operation + " with status " + status, response);
        }
        if (cause instanceof WebClientRequestException || cause instanceof TimeoutException) {
            log.warn("Qdrant {} failed: {}", operation, cause.getMessage());
            return new VectorStoreUnavailableException("Qdrant unreachable during " + operation, cause);
        }
        return error;
    }

    private SearchFilter buildFilter(Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) {
            return null;
        }
        List<FieldCondition> must = new ArrayList<>();
        filters.forEach((key, value) -> must.add(new FieldCondition(key, new Match(value))));
        return new SearchFilter(must);
    }

    private record Point(String id, float[] vector, Map<String, String> payload) {}

    private record UpsertRequest(List<Point> points) {}

    private record DeleteRequest(List<String> points) {}

    private record RetrieveRequest(List<String> ids,
                                   @JsonProperty("with_payload") boolean withPayload,
                                   @JsonProperty("with_vector") boolean withVector) {}

    private record RetrieveResponse(List<StoredPoint> result) {}

    private record StoredPoint(Object id) {}

    private record CreateCollectionRequest(VectorParams vectors) {}

    private record VectorParams(int size, String distance) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record SearchRequest(float[] vector,
                                 int limit,
                                 @JsonProperty("with_payload") boolean withPayload,
                                 SearchFilter filter,
                                 @JsonProperty("score_threshold") Double scoreThreshold) {}

    private record SearchFilter(List<FieldCondition> must) {}

    private record FieldCondition(String key, Match match) {}

    private record Match(String value) {}

    private record SearchResponse(List<ScoredPoint> result) {}

    private record ScoredPoint(Object id, double score, Map<String, Object> payload) {
        VectorMatch toMatch() {
            Map<String, String> values = new HashMap<>();
            if (payload != null) {
                payload.forEach((key, value) -> {
                    if (value != null) {
                        values.put(key, String.valueOf(value));
                    }
                });
            }
            return new VectorMatch(String.valueOf(id), score, values);
        }
    }

    private record CollectionResponse(CollectionInfo result) {}

    private record CollectionInfo(@JsonProperty("points_count") Long pointsCount) {}
}
