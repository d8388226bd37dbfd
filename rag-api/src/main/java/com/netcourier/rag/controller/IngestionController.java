package com.netcourier.rag.controller;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.model.DocumentStatus;
import com.netcourier.rag.model.IngestRequest;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import com.netcourier.rag.service.ingestion.IngestionCoordinator;
import com.netcourier.rag.service.ingestion.IngestionOutcome;
import com.netcourier.rag.service.ingestion.ObjectStore;
import jakarta.validation.Valid;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
public class IngestionController {

    private final IngestionCoordinator coordinator;
    private final ObjectStore objectStore;
    private final RagProperties properties;

    public IngestionController(IngestionCoordinator coordinator, ObjectStore objectStore, RagProperties properties) {
        this.coordinator = coordinator;
        this.objectStore = objectStore;
        this.properties = properties;
    }

    @PostMapping(path = "/ingest", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<IngestionOutcome> ingest(@Valid @RequestBody IngestRequest request) {
        return Mono.fromCallable(() -> coordinator.ingest(request.bucket(), request.key()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(path = "/ingest/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<IngestionOutcome> upload(@RequestPart("file") FilePart file,
                                         @RequestPart(value = "key", required = false) String key) {
        String filename = FilenameUtils.getName(file.filename());
        if (filename == null || filename.isBlank()) {
            return Mono.error(new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.INGESTION, "File name is required"));
        }
        String objectKey = key == null || key.isBlank()
                ? properties.ingestion().keyPrefix() + filename
                : key.trim();
        String bucket = properties.storage().defaultBucket();
        String contentType = file.headers().getContentType() == null ? null : file.headers().getContentType().toString();
        return DataBufferUtils.join(file.content())
                .map(this::toBytes)
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> {
                    objectStore.store(bucket, objectKey, bytes, contentType);
                    return coordinator.ingest(bucket, objectKey);
                });
    }

    @GetMapping(path = "/documents", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<DocumentStatus>> documents() {
        return Mono.fromCallable(coordinator::listDocuments)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(path = "/documents/{documentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DocumentStatus> document(@PathVariable String documentId) {
        return Mono.fromCallable(() -> coordinator.status(documentId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(path = "/documents/{documentId}/versions/{version}/retry", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<IngestionOutcome> retry(@PathVariable String documentId, @PathVariable int version) {
        return Mono.fromCallable(() -> coordinator.retry(documentId, version))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
