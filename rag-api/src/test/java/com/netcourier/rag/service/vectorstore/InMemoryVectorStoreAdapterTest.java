package com.netcourier.rag.service.vectorstore;

import com.netcourier.rag.service.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class InMemoryVectorStoreAdapterTest {

    private final InMemoryVectorStoreAdapter adapter = new InMemoryVectorStoreAdapter(3, 0.0);

    @Test
    void upsertIsIdempotentById() {
        adapter.upsert(List.of(record("c-1", "doc-a", 1, 0, 0)));
        adapter.upsert(List.of(record("c-1", "doc-a", 0, 1, 0)));

        assertThat(adapter.stats().totalVectors()).isEqualTo(1);
        List<VectorMatch> matches = adapter.search(new float[]{0, 1, 0}, 5, Map.of());
        assertThat(matches).singleElement().satisfies(match -> {
            assertThat(match.chunkId()).isEqualTo("c-1");
            assertThat(match.score()).isCloseTo(1.0, offset(1e-6));
        });
    }

    @Test
    void returnsFewerMatchesThanTopKWhenStoreIsSmall() {
        adapter.upsert(List.of(
                record("c-1", "doc-a", 1, 0, 0),
                record("c-2", "doc-a", 0, 1, 0),
                record("c-3", "doc-b", 0, 0, 1)));

        assertThat(adapter.search(new float[]{1, 1, 0}, 5, Map.of())).hasSize(3);
    }

    @Test
    void ordersByScoreThenChunkId() {
        adapter.upsert(List.of(
                record("c-b", "doc-a", 1, 0, 0),
                record("c-a", "doc-a", 1, 0, 0),
                record("c-c", "doc-a", 0, 1, 0)));

        List<VectorMatch> matches = adapter.search(new float[]{1, 0, 0}, 3, null);

        assertThat(matches).extracting(VectorMatch::chunkId).containsExactly("c-a", "c-b", "c-c");
        assertThat(matches.get(0).score()).isGreaterThanOrEqualTo(matches.get(2).score());
    }

    @Test
    void appliesPayloadFilters() {
        adapter.upsert(List.of(
                record("c-1", "doc-a", 1, 0, 0),
                record("c-2", "doc-b", 1, 0, 0)));

        List<VectorMatch> matches = adapter.search(new float[]{1, 0, 0}, 5, Map.of(VectorRecord.DOCUMENT_ID, "doc-b"));

        assertThat(matches).extracting(VectorMatch::documentId).containsExactly("doc-b");
    }

    @Test
    void dropsMatchesBelowMinimumScore() {
        InMemoryVectorStoreAdapter strict = new InMemoryVectorStoreAdapter(3, 0.5);
        strict.upsert(List.of(
                record("c-1", "doc-a", 1, 0, 0),
                record("c-2", "doc-a", 0, 1, 0)));

        assertThat(strict.search(new float[]{1, 0, 0}, 5, Map.of()))
                .extracting(VectorMatch::chunkId)
                .containsExactly("c-1");
    }

    @Test
    void rejectsVectorsOfTheWrongDimension() {
        assertThatThrownBy(() -> adapter.upsert(List.of(
                record("c-1", "doc-a", 1, 0, 0),
                new VectorRecord("c-2", new float[]{1, 0}, Map.of()))))
                .isInstanceOf(DimensionMismatchException.class);
        assertThat(adapter.stats().totalVectors()).isZero();

        assertThatThrownBy(() -> adapter.search(new float[]{1, 0, 0, 0}, 5, Map.of()))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void deleteReportsRemovedCount() {
        adapter.upsert(List.of(record("c-1", "doc-a", 1, 0, 0)));

        assertThat(adapter.delete(List.of("c-1", "missing"))).isEqualTo(1);
        assertThat(adapter.stats()).isEqualTo(new VectorStoreStats("memory", "cosine", 0, 3));
    }

    private static VectorRecord record(String id, String documentId, float... vector) {
        return new VectorRecord(id, vector, Map.of(VectorRecord.DOCUMENT_ID, documentId, VectorRecord.TEXT, "text of " + id));
    }
}
