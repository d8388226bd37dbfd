package com.netcourier.rag.service.ingestion;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentenceWindowChunkerTest {

    @Test
    void overlapsShortSentencesWithinTheWindow() {
        SentenceWindowChunker chunker = new SentenceWindowChunker(5, 2, Locale.ROOT);

        List<Chunk> chunks = chunker.chunk(document("A. B. C."));

        assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.text().length()).isLessThanOrEqualTo(5));
        for (int i = 1; i < chunks.size(); i++) {
            int overlap = chunks.get(i - 1).charEnd() - chunks.get(i).charStart();
            assertThat(overlap).isBetween(0, 2);
        }
        assertThat(chunks.get(0).text()).isEqualTo("A. B.");
        assertThat(chunks.get(chunks.size() - 1).text()).endsWith("C.");
    }

    @Test
    void closesWindowsOnSentenceBoundaries() {
        SentenceWindowChunker chunker = new SentenceWindowChunker(45, 10, Locale.ROOT);

        List<Chunk> chunks = chunker.chunk(document("First sentence here. Second sentence here. Third one."));

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly("First sentence here. Second sentence here.", "here. Third one.");
    }

    @Test
    void hardSplitsSentencesLongerThanTheWindow() {
        SentenceWindowChunker chunker = new SentenceWindowChunker(1000, 200, Locale.ROOT);
        String text = "x".repeat(2500);

        List<Chunk> chunks = chunker.chunk(document(text));

        assertThat(chunks).hasSize(3);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.text().length()).isLessThanOrEqualTo(1000));
        assertThat(chunks.get(0).charStart()).isZero();
        assertThat(chunks.get(2).charEnd()).isEqualTo(2500);
        assertThat(chunks.get(1).charStart()).isEqualTo(800);
    }

    @Test
    void keepsAdvancingWhenTheOverlapStartsBeforeTheLastSentenceEnd() {
        SentenceWindowChunker chunker = new SentenceWindowChunker(10, 4, Locale.ROOT);
        String text = "Aaaa. Bbbbbbbbbbbbbbbbbb.";

        List<Chunk> chunks = chunker.chunk(document(text));

        assertStrictlyAdvancing(chunks, 10);
        assertThat(chunks.get(0).text()).isEqualTo("Aaaa.");
        assertThat(chunks.get(chunks.size() - 1).charEnd()).isEqualTo(text.length());
    }

    @Test
    void hardSplitsInsteadOfRepeatingASentenceEndAlreadyEmitted() {
        SentenceWindowChunker chunker = new SentenceWindowChunker(1000, 200, Locale.ROOT);
        String sentences = String.join(" ", Collections.nCopies(8, "S" + "s".repeat(99) + "."));
        String text = sentences + " " + "Y" + "y".repeat(998);

        List<Chunk> chunks = chunker.chunk(document(text));

        assertStrictlyAdvancing(chunks, 1000);
        assertThat(chunks).extracting(Chunk::charEnd).containsExactly(815, 1714, 1815);
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i - 1).charEnd()).isGreaterThan(chunks.get(i).charStart());
        }
    }

    @Test
    void recordsAbsoluteOffsetsAndContiguousSequence() {
        SentenceWindowChunker chunker = new SentenceWindowChunker(60, 15, Locale.ROOT);
        String text = "Invoices are due within thirty days. Late payments accrue interest. "
                + "Disputes must be raised in writing. Refunds are issued to the original payment method.";

        List<Chunk> chunks = chunker.chunk(document(text));

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).extracting(Chunk::sequenceIndex)
                .containsExactlyElementsOf(IntStream.range(0, chunks.size()).boxed().toList());
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(text.substring(chunk.charStart(), chunk.charEnd())).isEqualTo(chunk.text());
            assertThat(chunk.documentId()).isEqualTo("doc-1");
            assertThat(chunk.version()).isEqualTo(3);
            assertThat(chunk.contentHash()).isEqualTo(ContentHashes.sha256(chunk.text()));
        });
        assertThat(chunks.get(chunks.size() - 1).charEnd()).isEqualTo(text.length());
    }

    @Test
    void producesIdenticalChunksForIdenticalInput() {
        SentenceWindowChunker chunker = new SentenceWindowChunker(80, 20, Locale.ROOT);
        String text = "Alpha beta gamma. Delta epsilon zeta. Eta theta iota. Kappa lambda mu. Nu xi omicron.";

        assertThat(chunker.chunk(document(text))).isEqualTo(chunker.chunk(document(text)));
        assertThat(chunker.chunk(document(text))).extracting(Chunk::chunkId).doesNotHaveDuplicates();
    }

    @Test
    void returnsNoChunksForBlankText() {
        SentenceWindowChunker chunker = new SentenceWindowChunker(100, 10, Locale.ROOT);

        assertThat(chunker.chunk(document("   \n\t "))).isEmpty();
    }

    @Test
    void rejectsOverlapNotSmallerThanWindow() {
        assertThatThrownBy(() -> new SentenceWindowChunker(10, 10, Locale.ROOT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static void assertStrictlyAdvancing(List<Chunk> chunks, int maxChunkSize) {
        assertThat(chunks).isNotEmpty();
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.text().length()).isLessThanOrEqualTo(maxChunkSize));
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i).charEnd()).isGreaterThan(chunks.get(i - 1).charEnd());
            assertThat(chunks.get(i).charStart()).isGreaterThan(chunks.get(i - 1).charStart());
        }
    }

    private Document document(String text) {
        return new Document("doc-1", "s3://bucket/uploads/doc.txt", "text/plain", text, 3);
    }
}
