package com.netcourier.rag.controller;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.model.DocumentStatus;
import com.netcourier.rag.model.VersionStatus;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import com.netcourier.rag.service.ingestion.IngestionCoordinator;
import com.netcourier.rag.service.ingestion.IngestionOutcome;
import com.netcourier.rag.service.ingestion.ObjectStore;
import com.netcourier.rag.service.ingestion.UnsupportedFormatException;
import com.netcourier.rag.service.ingestion.statemachine.IngestionStates;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = IngestionController.class)
@ActiveProfiles("test")
@EnableConfigurationProperties(RagProperties.class)
class IngestionControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private IngestionCoordinator coordinator;

    @MockBean
    private ObjectStore objectStore;

    @Test
    void acceptsObjectCreatedNotification() {
        when(coordinator.ingest("docs", "uploads/guide.pdf"))
                .thenReturn(new IngestionOutcome("0123456789abcdef", 1, IngestionStates.QUEUED, 4, false));

        webTestClient.post()
                .uri("/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("bucket", "docs", "key", "uploads/guide.pdf"))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.document_id").isEqualTo("0123456789abcdef")
                .jsonPath("$.status").isEqualTo("QUEUED")
                .jsonPath("$.chunks").isEqualTo(4);
    }

    @Test
    void rejectsNotificationWithoutKey() {
        webTestClient.post()
                .uri("/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("bucket", "docs"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.stage").isEqualTo("INGESTION");

        verifyNoInteractions(coordinator);
    }

    @Test
    void reportsUnsupportedFormats() {
        when(coordinator.ingest(any(), any())).thenThrow(new UnsupportedFormatException("Unsupported content type image/png"));

        webTestClient.post()
                .uri("/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("key", "uploads/scan.png"))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Unsupported content type image/png");
    }

    @Test
    void storesUploadUnderPrefixBeforeIngesting() {
        when(coordinator.ingest("test-bucket", "uploads/notes.txt"))
                .thenReturn(new IngestionOutcome("fedcba9876543210", 1, IngestionStates.QUEUED, 1, false));
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new ByteArrayResource("Delivery notes".getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "notes.txt";
            }
        }).contentType(MediaType.TEXT_PLAIN);

        webTestClient.post()
                .uri("/ingest/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.document_id").isEqualTo("fedcba9876543210");

        verify(objectStore).store(eq("test-bucket"), eq("uploads/notes.txt"), any(), eq("text/plain"));
    }

    @Test
    void returnsDocumentStatus() {
        when(coordinator.status("0123456789abcdef")).thenReturn(new DocumentStatus("0123456789abcdef",
                "s3://docs/uploads/guide.pdf",
                List.of(new VersionStatus(1, "INDEXED", "application/pdf", "Guide", 2,
                        List.of("c-1", "c-2"), List.of(), null, null, null))));

        webTestClient.get()
                .uri("/documents/0123456789abcdef")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.source_uri").isEqualTo("s3://docs/uploads/guide.pdf")
                .jsonPath("$.versions[0].status").isEqualTo("INDEXED")
                .jsonPath("$.versions[0].indexed_chunk_ids.length()").isEqualTo(2);
    }

    @Test
    void retryConflictIsReported() {
        when(coordinator.retry("0123456789abcdef", 1)).thenThrow(new PipelineException(HttpStatus.CONFLICT,
                PipelineStage.INGESTION, "Only FAILED versions can be retried"));

        webTestClient.post()
                .uri("/documents/0123456789abcdef/versions/1/retry")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.CONFLICT)
                .expectBody()
                .jsonPath("$.stage").isEqualTo("INGESTION");
    }
}
