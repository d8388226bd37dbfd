package com.netcourier.rag;

import com.netcourier.rag.service.embedding.DeterministicEmbeddingClient;
import com.netcourier.rag.service.ingestion.Chunk;
import com.netcourier.rag.service.ingestion.Document;
import com.netcourier.rag.service.ingestion.FileSystemObjectStore;
import com.netcourier.rag.service.ingestion.SentenceWindowChunker;
import com.netcourier.rag.service.queue.InMemoryChunkWorkQueue;
import com.netcourier.rag.service.vectorstore.InMemoryVectorStoreAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RagApiApplicationTest {

    @Autowired
    private DeterministicEmbeddingClient embeddingClient;

    @Autowired
    private SentenceWindowChunker chunker;

    @Autowired
    private InMemoryVectorStoreAdapter vectorStore;

    @Autowired
    private InMemoryChunkWorkQueue workQueue;

    @Autowired
    private FileSystemObjectStore objectStore;

    @Test
    void componentsAreBuiltFromConfiguredProperties() {
        assertThat(embeddingClient.embed(List.of("parcel")).block()).singleElement()
                .satisfies(vector -> assertThat(vector).hasSize(64));
        assertThat(vectorStore.stats().dimension()).isEqualTo(64);

        List<Chunk> chunks = chunker.chunk(new Document("doc-1", "s3://test-bucket/uploads/a.txt", "text/plain",
                "x".repeat(1500), 1));
        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(1).charStart()).isEqualTo(800);

        assertThat(workQueue.pending()).isNotNegative();
        assertThat(objectStore).isNotNull();
    }
}
