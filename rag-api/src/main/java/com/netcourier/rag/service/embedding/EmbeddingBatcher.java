package com.netcourier.rag.service.embedding;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.DimensionMismatchException;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Turns lists of texts into vectors with bounded batch size and parallelism. Transient provider failures
 * are retried with jittered exponential backoff; a permanently rejected batch is re-sent item by item so a
 * single bad input does not sink its neighbours.
 */
@Component
public class EmbeddingBatcher {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingBatcher.class);

    private final EmbeddingClient client;
    private final RagProperties.Embedding settings;
    private final Counter retries;
    private final Counter itemFailures;

    public EmbeddingBatcher(EmbeddingClient client, RagProperties properties, MeterRegistry meterRegistry) {
        this.client = client;
        this.settings = properties.embedding();
        this.retries = meterRegistry.counter("rag.embedding.retries");
        this.itemFailures = meterRegistry.counter("rag.embedding.item.failures");
    }

    public EmbeddingResult embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return new EmbeddingResult(List.of(), List.of(), client.modelName());
        }
        float[][] vectors = new float[texts.size()][];
        List<EmbeddingItemError> errors = new ArrayList<>();

        List<Integer> valid = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text == null || text.isBlank()) {
                errors.add(new EmbeddingItemError(i, "empty input"));
            } else if (text.length() > settings.maxInputChars()) {
                errors.add(new EmbeddingItemError(i, "input of " + text.length()
                        + " characters exceeds limit of " + settings.maxInputChars()));
            } else {
                valid.add(i);
            }
        }

        List<List<Integer>> batches = new ArrayList<>();
        for (int from = 0; from < valid.size(); from += settings.maxBatchSize()) {
            batches.add(valid.subList(from, Math.min(valid.size(), from + settings.maxBatchSize())));
        }

        List<BatchOutcome> outcomes = Flux.fromIterable(batches)
                .flatMapSequential(batch -> embedBatch(texts, batch).subscribeOn(Schedulers.boundedElastic()),
                        settings.parallelism())
                .collectList()
                .block();

        if (outcomes != null) {
            for (BatchOutcome outcome : outcomes) {
                for (int i = 0; i < outcome.indexes().size(); i++) {
                    vectors[outcome.indexes().get(i)] = outcome.vectors().get(i);
                }
                errors.addAll(outcome.errors());
            }
        }
        if (!errors.isEmpty()) {
            itemFailures.increment(errors.size());
            log.warn("Embedding finished with {} failed item(s) out of {}", errors.size(), texts.size());
        }
        return new EmbeddingResult(Arrays.asList(vectors), errors, client.modelName());
    }

    public EmbeddingVector embedQuery(String id, String text) {
        EmbeddingResult result = embed(List.of(text));
        if (result.hasErrors()) {
            throw new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.EMBEDDING,
                    "Query could not be embedded: " + result.errors().get(0).reason());
        }
        float[] vector = result.vectors().get(0);
        return new EmbeddingVector(id, vector, result.modelName(), vector.length);
    }

    private Mono<BatchOutcome> embedBatch(List<String> texts, List<Integer> indexes) {
        List<String> batchTexts = indexes.stream().map(texts::get).toList();
        return client.embed(batchTexts)
                .map(vectors -> accept(indexes, vectors))
                .retryWhen(retrySpec(batchTexts))
                .onErrorResume(this::isPermanent, error -> isolate(texts, indexes, error));
    }

    private BatchOutcome accept(List<Integer> indexes, List<float[]> vectors) {
        if (vectors == null || vectors.size() != indexes.size()) {
            throw new IllegalStateException("Embedding provider returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + indexes.size() + " inputs");
        }
        for (float[] vector : vectors) {
            if (vector.length != settings.dimension()) {
                throw new DimensionMismatchException(PipelineStage.EMBEDDING, settings.dimension(), vector.length);
            }
        }
        return new BatchOutcome(indexes, vectors, List.of());
    }

    private Mono<BatchOutcome> isolate(List<String> texts, List<Integer> indexes, Throwable error) {
        if (indexes.size() == 1) {
            log.warn("Embedding input {} rejected: {}", indexes.get(0), error.getMessage());
            List<float[]> none = new ArrayList<>();
            none.add(null);
            return Mono.just(new BatchOutcome(indexes, none,
                    List.of(new EmbeddingItemError(indexes.get(0), describe(error)))));
        }
        log.warn("Embedding batch of {} rejected ({}), retrying items individually", indexes.size(), error.getMessage());
        return Flux.fromIterable(indexes)
                .concatMap(index -> embedBatch(texts, List.of(index)))
                .collectList()
                .map(BatchOutcome::merge);
    }

    private Retry retrySpec(List<String> batchTexts) {
        return Retry.backoff(settings.maxRetries(), settings.initialBackoff())
                .maxBackoff(settings.maxBackoff())
                .jitter(0.5)
                .filter(EmbeddingBatcher::isTransient)
                .doBeforeRetry(signal -> {
                    retries.increment();
                    log.warn("Embedding call failed (attempt {}), retrying: {}",
                            signal.totalRetries() + 1, signal.failure().getMessage());
                })
                .onRetryExhaustedThrow((spec, signal) -> new EmbeddingUnavailableException(batchTexts, signal.failure()));
    }

    private boolean isPermanent(Throwable error) {
        return !(error instanceof PipelineException) && !isTransient(error);
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof EmbeddingCallException call) {
            return call.isTransient();
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return status == 408 || status == 429 || status >= 500;
        }
        return error instanceof WebClientRequestException
                || error instanceof TimeoutException
                || error instanceof IOException;
    }

    private static String describe(Throwable error) {
        if (error instanceof EmbeddingCallException call && call.statusCode() > 0) {
            return "rejected with status " + call.statusCode() + ": " + call.getMessage();
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private record BatchOutcome(List<Integer> indexes, List<float[]> vectors, List<EmbeddingItemError> errors) {

        static BatchOutcome merge(List<BatchOutcome> parts) {
            List<Integer> indexes = new ArrayList<>();
            List<float[]> vectors = new ArrayList<>();
            List<EmbeddingItemError> errors = new ArrayList<>();
            for (BatchOutcome part : parts) {
                indexes.addAll(part.indexes());
                vectors.addAll(part.vectors());
                errors.addAll(part.errors());
            }
            return new BatchOutcome(indexes, vectors, errors);
        }
    }
}
