package com.netcourier.rag.service.embedding;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.DimensionMismatchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingBatcherTest {

    private static final int DIMENSION = 4;

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void reportsOversizedItemWithoutSendingIt() {
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(texts -> Mono.just(vectorsFor(texts)));
        EmbeddingBatcher batcher = batcher(client, 100, 50);
        List<String> texts = new ArrayList<>(IntStream.range(0, 10).mapToObj(i -> "chunk " + i).toList());
        texts.set(3, "y".repeat(51));

        EmbeddingResult result = batcher.embed(texts);

        assertThat(result.size()).isEqualTo(10);
        assertThat(result.successCount()).isEqualTo(9);
        assertThat(result.errors()).singleElement()
                .satisfies(error -> assertThat(error.index()).isEqualTo(3));
        assertThat(result.vectors().get(3)).isNull();
        assertThat(result.vectors().get(4)[0]).isEqualTo((float) "chunk 4".hashCode());
        assertThat(client.sentTexts()).hasSize(9).doesNotContain(texts.get(3));
        assertThat(meterRegistry.counter("rag.embedding.item.failures").count()).isEqualTo(1.0);
    }

    @Test
    void splitsIntoBatchesAndPreservesOrder() {
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(texts -> Mono.just(vectorsFor(texts)));
        EmbeddingBatcher batcher = batcher(client, 100, 1000);
        List<String> texts = IntStream.range(0, 250).mapToObj(i -> "text-" + i).toList();

        EmbeddingResult result = batcher.embed(texts);

        assertThat(client.calls()).isEqualTo(3);
        assertThat(client.batchSizes()).containsExactlyInAnyOrder(100, 100, 50);
        assertThat(result.hasErrors()).isFalse();
        for (int i = 0; i < texts.size(); i++) {
            assertThat(result.vectors().get(i)[0]).isEqualTo((float) texts.get(i).hashCode());
        }
    }

    @Test
    void retriesTransientFailuresBeforeSucceeding() {
        AtomicInteger attempts = new AtomicInteger();
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(texts -> attempts.incrementAndGet() <= 2
                ? Mono.error(new EmbeddingCallException(503, "unavailable"))
                : Mono.just(vectorsFor(texts)));
        EmbeddingBatcher batcher = batcher(client, 100, 1000);

        EmbeddingResult result = batcher.embed(List.of("a", "b"));

        assertThat(result.successCount()).isEqualTo(2);
        assertThat(meterRegistry.counter("rag.embedding.retries").count()).isEqualTo(2.0);
    }

    @Test
    void raisesUnavailableWithTheBatchWhenRetriesRunOut() {
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(
                texts -> Mono.error(new EmbeddingCallException(429, "rate limited")));
        EmbeddingBatcher batcher = batcher(client, 100, 1000);

        assertThatThrownBy(() -> batcher.embed(List.of("first", "second")))
                .isInstanceOfSatisfying(EmbeddingUnavailableException.class, ex -> {
                    assertThat(ex.batch()).containsExactly("first", "second");
                    assertThat(ex.retryable()).isTrue();
                });
        assertThat(client.calls()).isEqualTo(4);
    }

    @Test
    void isolatesPermanentlyRejectedItems() {
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(texts -> texts.contains("poison")
                ? Mono.error(new EmbeddingCallException(400, "invalid input"))
                : Mono.just(vectorsFor(texts)));
        EmbeddingBatcher batcher = batcher(client, 100, 1000);

        EmbeddingResult result = batcher.embed(List.of("good one", "poison", "good two"));

        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.index()).isEqualTo(1);
            assertThat(error.reason()).contains("400");
        });
        assertThat(result.vectors().get(2)[0]).isEqualTo((float) "good two".hashCode());
    }

    @Test
    void failsOnVectorsOfTheWrongDimension() {
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(
                texts -> Mono.just(texts.stream().map(text -> new float[DIMENSION + 1]).toList()));
        EmbeddingBatcher batcher = batcher(client, 100, 1000);

        assertThatThrownBy(() -> batcher.embed(List.of("text")))
                .isInstanceOfSatisfying(DimensionMismatchException.class, ex -> {
                    assertThat(ex.expected()).isEqualTo(DIMENSION);
                    assertThat(ex.actual()).isEqualTo(DIMENSION + 1);
                });
    }

    @Test
    void embedsSingleQuery() {
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(texts -> Mono.just(vectorsFor(texts)));
        EmbeddingBatcher batcher = batcher(client, 100, 1000);

        EmbeddingVector vector = batcher.embedQuery("q-1", "where is my parcel");

        assertThat(vector.id()).isEqualTo("q-1");
        assertThat(vector.dimension()).isEqualTo(DIMENSION);
        assertThat(vector.modelName()).isEqualTo("scripted");
    }

    private EmbeddingBatcher batcher(EmbeddingClient client, int batchSize, int maxInputChars) {
        RagProperties properties = new RagProperties(null,
                new RagProperties.Embedding("scripted", DIMENSION, batchSize, 4, 3,
                        Duration.ofMillis(1), Duration.ofMillis(5), maxInputChars),
                null, null, null, null, null, null, null);
        return new EmbeddingBatcher(client, properties, meterRegistry);
    }

    private static List<float[]> vectorsFor(List<String> texts) {
        return texts.stream()
                .map(text -> new float[]{text.hashCode(), 1f, 2f, 3f})
                .toList();
    }

    private static final class ScriptedEmbeddingClient implements EmbeddingClient {

        private final Function<List<String>, Mono<List<float[]>>> script;
        private final List<List<String>> batches = Collections.synchronizedList(new ArrayList<>());

        ScriptedEmbeddingClient(Function<List<String>, Mono<List<float[]>>> script) {
            this.script = script;
        }

        @Override
        public Mono<List<float[]>> embed(List<String> texts) {
            return Mono.defer(() -> {
                batches.add(List.copyOf(texts));
                return script.apply(texts);
            });
        }

        @Override
        public String modelName() {
            return "scripted";
        }

        int calls() {
            return batches.size();
        }

        List<Integer> batchSizes() {
            synchronized (batches) {
                return batches.stream().map(List::size).toList();
            }
        }

        List<String> sentTexts() {
            synchronized (batches) {
                return batches.stream().flatMap(List::stream).toList();
            }
        }
    }
}
