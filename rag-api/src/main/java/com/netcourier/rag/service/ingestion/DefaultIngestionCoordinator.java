package com.netcourier.rag.service.ingestion;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.model.DocumentStatus;
import com.netcourier.rag.model.VersionStatus;
import com.netcourier.rag.persistence.entity.ChunkRecordEntity;
import com.netcourier.rag.persistence.entity.ChunkStatus;
import com.netcourier.rag.persistence.entity.DocumentVersionEntity;
import com.netcourier.rag.persistence.repository.ChunkRecordRepository;
import com.netcourier.rag.persistence.repository.DocumentVersionRepository;
import com.netcourier.rag.service.DimensionMismatchException;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import com.netcourier.rag.service.embedding.EmbeddingBatcher;
import com.netcourier.rag.service.embedding.EmbeddingItemError;
import com.netcourier.rag.service.embedding.EmbeddingResult;
import com.netcourier.rag.service.embedding.EmbeddingUnavailableException;
import com.netcourier.rag.service.ingestion.statemachine.IngestionEvents;
import com.netcourier.rag.service.ingestion.statemachine.IngestionStateTransitions;
import com.netcourier.rag.service.ingestion.statemachine.IngestionStates;
import com.netcourier.rag.service.queue.ChunkWorkItem;
import com.netcourier.rag.service.queue.ChunkWorkQueue;
import com.netcourier.rag.service.queue.QueueDelivery;
import com.netcourier.rag.service.vectorstore.VectorRecord;
import com.netcourier.rag.service.vectorstore.VectorStoreAdapter;
import com.netcourier.rag.service.vectorstore.VectorStoreUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class DefaultIngestionCoordinator implements IngestionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionCoordinator.class);

    private final ObjectStore objectStore;
    private final DocumentTextExtractor textExtractor;
    private final TextChunker textChunker;
    private final EmbeddingBatcher embeddingBatcher;
    private final VectorStoreAdapter vectorStore;
    private final ChunkWorkQueue workQueue;
    private final DocumentVersionRepository versionRepository;
    private final ChunkRecordRepository chunkRepository;
    private final IngestionStateTransitions transitions;
    private final RagProperties properties;
    private final MeterRegistry meterRegistry;
    private final Timer ingestionTimer;

    public DefaultIngestionCoordinator(ObjectStore objectStore,
                                       DocumentTextExtractor textExtractor,
                                       TextChunker textChunker,
                                       EmbeddingBatcher embeddingBatcher,
                                       VectorStoreAdapter vectorStore,
                                       ChunkWorkQueue workQueue,
                                       DocumentVersionRepository versionRepository,
                                       ChunkRecordRepository chunkRepository,
                                       IngestionStateTransitions transitions,
                                       RagProperties properties,
                                       MeterRegistry meterRegistry) {
        this.objectStore = objectStore;
        this.textExtractor = textExtractor;
        this.textChunker = textChunker;
        this.embeddingBatcher = embeddingBatcher;
        this.vectorStore = vectorStore;
        this.workQueue = workQueue;
        this.versionRepository = versionRepository;
        this.chunkRepository = chunkRepository;
        this.transitions = transitions;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.ingestionTimer = meterRegistry.timer("rag.ingest.duration");
    }

    @Override
    public IngestionOutcome ingest(String bucket, String key) {
        String resolvedBucket = bucket == null || bucket.isBlank() ? properties.storage().defaultBucket() : bucket.trim();
        if (key == null || key.isBlank()) {
            throw new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.INGESTION, "Object key is required");
        }
        String prefix = properties.ingestion().keyPrefix();
        if (!key.startsWith(prefix)) {
            throw new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.INGESTION,
                    "Object key must start with " + prefix);
        }
        return ingestionTimer.record(() -> ingestObject(resolvedBucket, key));
    }

    private IngestionOutcome ingestObject(String bucket, String key) {
        String documentId = ContentHashes.documentId(bucket, key);
        StoredObject object = objectStore.fetch(bucket, key);
        String contentType = object.contentType() == null ? FileTypes.fromKey(key) : object.contentType();

        ExtractedText extracted;
        try {
            extracted = textExtractor.extract(key, contentType, object.content());
        } catch (UnsupportedFormatException ex) {
            countOutcome("unsupported");
            log.warn("Rejected {} ({}): {}", object.uri(), contentType, ex.getMessage());
            throw ex;
        }
        String contentHash = ContentHashes.sha256(extracted.text());

        DocumentVersionEntity latest = versionRepository.findTopByDocumentIdOrderByVersionDesc(documentId).orElse(null);
        if (latest != null && latest.getContentHash().equals(contentHash)) {
            if (IngestionStates.FAILED.name().equals(latest.getStatus())) {
                log.info("Re-upload of {} matches failed version {}, retrying it", documentId, latest.getVersion());
                return retry(documentId, latest.getVersion());
            }
            countOutcome("deduplicated");
            log.info("Skipping ingestion of {}: content unchanged since version {}", object.uri(), latest.getVersion());
            return new IngestionOutcome(documentId, latest.getVersion(), IngestionStates.valueOf(latest.getStatus()),
                    latest.getChunkCount(), true);
        }

        int version = latest == null ? 1 : latest.getVersion() + 1;
        DocumentVersionEntity entity = new DocumentVersionEntity();
        entity.setDocumentId(documentId);
        entity.setVersion(version);
        entity.setBucket(bucket);
        entity.setObjectKey(key);
        entity.setSourceUri(object.uri());
        entity.setContentType(extracted.contentType() == null ? contentType : extracted.contentType());
        entity.setTitle(extracted.title());
        entity.setContentHash(contentHash);
        entity.setStatus(IngestionStates.RECEIVED.name());
        entity.setChunkCount(0);
        entity = versionRepository.save(entity);

        Document document = new Document(documentId, object.uri(), entity.getContentType(), extracted.text(), version);
        List<Chunk> chunks = textChunker.chunk(document);
        chunkRepository.saveAll(chunks.stream()
                .map(chunk -> new ChunkRecordEntity(chunk.chunkId(), documentId, version, chunk.sequenceIndex(),
                        chunk.text(), chunk.charStart(), chunk.charEnd(), chunk.contentHash()))
                .toList());
        entity.setChunkCount(chunks.size());
        transition(entity, IngestionEvents.CHUNK);

        // a consumer may receive the first chunk before the loop below finishes
        transition(entity, IngestionEvents.ENQUEUE);
        try {
            chunks.forEach(chunk -> workQueue.send(ChunkWorkItem.of(chunk)));
        } catch (RuntimeException ex) {
            log.error("Failed to enqueue chunks of {} v{}", documentId, version, ex);
            versionRepository.findByDocumentIdAndVersion(documentId, version)
                    .ifPresent(current -> fail(current, "Enqueue failed: " + ex.getMessage()));
            throw ex;
        }
        countOutcome("accepted");
        log.info("Queued {} chunk(s) for {} v{} from {}", chunks.size(), documentId, version, object.uri());
        return new IngestionOutcome(documentId, version, IngestionStates.QUEUED, chunks.size(), false);
    }

    @Override
    public DeliveryOutcome handleDeliveries(List<QueueDelivery> deliveries) {
        if (deliveries == null || deliveries.isEmpty()) {
            return DeliveryOutcome.empty();
        }
        Set<String> settled = new HashSet<>();
        try {
            return process(deliveries, settled);
        } catch (RuntimeException ex) {
            List<QueueDelivery> unsettled = deliveries.stream()
                    .filter(delivery -> !settled.contains(delivery.receiptHandle()))
                    .toList();
            log.error("Unexpected failure while indexing, returning {} message(s) to the queue", unsettled.size(), ex);
            unsettled.forEach(delivery -> nack(delivery, settled));
            return new DeliveryOutcome(0, 0, unsettled.size(), deliveries.size() - unsettled.size(), false);
        }
    }

    private DeliveryOutcome process(List<QueueDelivery> deliveries, Set<String> settled) {
        Map<VersionKey, DocumentVersionEntity> versions = new LinkedHashMap<>();
        List<QueueDelivery> pending = new ArrayList<>();
        List<ChunkRecordEntity> records = new ArrayList<>();
        int skipped = 0;

        for (QueueDelivery delivery : deliveries) {
            ChunkWorkItem item = delivery.item();
            ChunkRecordEntity record = chunkRepository.findByDocumentIdAndVersionAndSequenceIndex(
                    item.documentId(), item.version(), item.sequenceIndex()).orElse(null);
            if (record == null) {
                log.warn("Dropping message for unknown chunk {} of {} v{}", item.chunkId(), item.documentId(), item.version());
                ack(delivery, settled);
                skipped++;
                continue;
            }
            if (record.getStatus() == ChunkStatus.INDEXED) {
                ack(delivery, settled);
                skipped++;
                continue;
            }
            DocumentVersionEntity version = versions.computeIfAbsent(new VersionKey(item.documentId(), item.version()),
                    key -> versionRepository.findByDocumentIdAndVersion(key.documentId(), key.version()).orElse(null));
            if (version == null) {
                ack(delivery, settled);
                skipped++;
                continue;
            }
            if (IngestionStates.QUEUED.name().equals(version.getStatus())) {
                transition(version, IngestionEvents.EMBED);
            }
            record.setAttempts(record.getAttempts() + 1);
            pending.add(delivery);
            records.add(record);
        }
        if (pending.isEmpty()) {
            return new DeliveryOutcome(0, 0, 0, skipped, false);
        }

        EmbeddingResult result;
        try {
            result = embeddingBatcher.embed(records.stream().map(ChunkRecordEntity::getText).toList());
        } catch (EmbeddingUnavailableException ex) {
            log.warn("Embedding unavailable, returning {} message(s) to the queue: {}", pending.size(), ex.getMessage());
            chunkRepository.saveAll(records);
            pending.forEach(delivery -> nack(delivery, settled));
            return new DeliveryOutcome(0, 0, pending.size(), skipped, true);
        } catch (DimensionMismatchException ex) {
            log.error("Embedding dimension mismatch, failing {} chunk(s)", pending.size(), ex);
            failAll(pending, records, versions, ex.getMessage(), settled);
            return new DeliveryOutcome(0, pending.size(), 0, skipped, false);
        }

        Map<Integer, String> itemErrors = result.errors().stream()
                .collect(Collectors.toMap(EmbeddingItemError::index, EmbeddingItemError::reason));
        List<VectorRecord> vectors = new ArrayList<>();
        List<Integer> embedded = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            float[] vector = result.vectors().get(i);
            if (vector == null) {
                continue;
            }
            ChunkRecordEntity record = records.get(i);
            DocumentVersionEntity version = versions.get(new VersionKey(record.getDocumentId(), record.getVersion()));
            vectors.add(new VectorRecord(record.getChunkId(), vector, payloadFor(record, version)));
            embedded.add(i);
        }

        try {
            vectorStore.upsert(vectors);
        } catch (VectorStoreUnavailableException ex) {
            log.warn("Vector store unavailable, returning {} message(s) to the queue: {}", pending.size(), ex.getMessage());
            chunkRepository.saveAll(records);
            pending.forEach(delivery -> nack(delivery, settled));
            return new DeliveryOutcome(0, 0, pending.size(), skipped, true);
        } catch (DimensionMismatchException ex) {
            log.error("Vector store rejected dimension, failing {} chunk(s)", pending.size(), ex);
            failAll(pending, records, versions, ex.getMessage(), settled);
            return new DeliveryOutcome(0, pending.size(), 0, skipped, false);
        }

        int indexed = 0;
        int failed = 0;
        Set<VersionKey> failedVersions = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            ChunkRecordEntity record = records.get(i);
            if (embedded.contains(i)) {
                record.setStatus(ChunkStatus.INDEXED);
                record.setError(null);
                indexed++;
            } else {
                record.setStatus(ChunkStatus.FAILED);
                record.setError(itemErrors.getOrDefault(i, "embedding failed"));
                failedVersions.add(new VersionKey(record.getDocumentId(), record.getVersion()));
                failed++;
            }
        }
        chunkRepository.saveAll(records);
        pending.forEach(delivery -> ack(delivery, settled));

        for (Map.Entry<VersionKey, DocumentVersionEntity> entry : versions.entrySet()) {
            DocumentVersionEntity version = entry.getValue();
            if (version == null) {
                continue;
            }
            if (failedVersions.contains(entry.getKey())) {
                fail(version, "One or more chunks could not be embedded");
            } else {
                completeIfIndexed(version);
            }
        }
        return new DeliveryOutcome(indexed, failed, 0, skipped, false);
    }

    @Override
    public void onDeadLetter(ChunkWorkItem item) {
        log.error("Chunk {} of {} v{} exhausted its deliveries", item.chunkId(), item.documentId(), item.version());
        chunkRepository.findByDocumentIdAndVersionAndSequenceIndex(item.documentId(), item.version(), item.sequenceIndex())
                .filter(record -> record.getStatus() != ChunkStatus.INDEXED)
                .ifPresent(record -> {
                    record.setStatus(ChunkStatus.FAILED);
                    record.setError("Exceeded maximum receive count");
                    chunkRepository.save(record);
                    versionRepository.findByDocumentIdAndVersion(item.documentId(), item.version())
                            .ifPresent(version -> fail(version, "Chunk " + item.chunkId() + " moved to dead-letter queue"));
                });
    }

    @Override
    public IngestionOutcome retry(String documentId, int version) {
        DocumentVersionEntity entity = versionRepository.findByDocumentIdAndVersion(documentId, version)
                .orElseThrow(() -> new PipelineException(HttpStatus.NOT_FOUND, PipelineStage.INGESTION,
                        "Document " + documentId + " version " + version + " not found"));
        if (!IngestionStates.FAILED.name().equals(entity.getStatus())) {
            throw new PipelineException(HttpStatus.CONFLICT, PipelineStage.INGESTION,
                    "Only FAILED versions can be retried, " + documentId + " v" + version + " is " + entity.getStatus());
        }
        List<ChunkRecordEntity> retryable = chunkRepository.findByDocumentIdAndVersionOrderBySequenceIndexAsc(documentId, version)
                .stream()
                .filter(record -> record.getStatus() != ChunkStatus.INDEXED)
                .toList();
        retryable.forEach(record -> {
            record.setStatus(ChunkStatus.PENDING);
            record.setAttempts(0);
            record.setError(null);
        });
        chunkRepository.saveAll(retryable);
        entity.setError(null);
        transition(entity, IngestionEvents.RETRY);
        retryable.forEach(record -> workQueue.send(new ChunkWorkItem(documentId, version, record.getChunkId(),
                record.getSequenceIndex(), record.getText(), record.getCharStart(), record.getCharEnd())));
        countOutcome("retried");
        log.info("Re-queued {} chunk(s) of {} v{}", retryable.size(), documentId, version);
        return new IngestionOutcome(documentId, version, IngestionStates.QUEUED, entity.getChunkCount(), false);
    }

    @Override
    public DocumentStatus status(String documentId) {
        List<DocumentVersionEntity> versions = versionRepository.findByDocumentIdOrderByVersionAsc(documentId);
        if (versions.isEmpty()) {
            throw new PipelineException(HttpStatus.NOT_FOUND, PipelineStage.INGESTION, "Document " + documentId + " not found");
        }
        return toStatus(documentId, versions);
    }

    @Override
    public List<DocumentStatus> listDocuments() {
        Map<String, List<DocumentVersionEntity>> byDocument = new LinkedHashMap<>();
        for (DocumentVersionEntity version : versionRepository.findAllByOrderByDocumentIdAscVersionAsc()) {
            byDocument.computeIfAbsent(version.getDocumentId(), key -> new ArrayList<>()).add(version);
        }
        return byDocument.entrySet().stream()
                .map(entry -> toStatus(entry.getKey(), entry.getValue()))
                .toList();
    }

    private void completeIfIndexed(DocumentVersionEntity version) {
        IngestionStates state = IngestionStates.valueOf(version.getStatus());
        if (state != IngestionStates.EMBEDDING && state != IngestionStates.QUEUED) {
            return;
        }
        long indexed = chunkRepository.countByDocumentIdAndVersionAndStatus(
                version.getDocumentId(), version.getVersion(), ChunkStatus.INDEXED);
        if (indexed < version.getChunkCount()) {
            return;
        }
        if (state == IngestionStates.QUEUED) {
            transition(version, IngestionEvents.EMBED);
        }
        transition(version, IngestionEvents.COMPLETE);
        countOutcome("indexed");
        removeSupersededVectors(version);
    }

    private void removeSupersededVectors(DocumentVersionEntity current) {
        Set<String> currentIds = chunkRepository
                .findByDocumentIdAndVersionOrderBySequenceIndexAsc(current.getDocumentId(), current.getVersion())
                .stream()
                .map(ChunkRecordEntity::getChunkId)
                .collect(Collectors.toSet());
        Set<String> stale = new HashSet<>();
        for (DocumentVersionEntity older : versionRepository.findByDocumentIdOrderByVersionAsc(current.getDocumentId())) {
            if (older.getVersion() >= current.getVersion()) {
                continue;
            }
            chunkRepository.findByDocumentIdAndVersionOrderBySequenceIndexAsc(older.getDocumentId(), older.getVersion())
                    .stream()
                    .map(ChunkRecordEntity::getChunkId)
                    .filter(id -> !currentIds.contains(id))
                    .forEach(stale::add);
        }
        if (stale.isEmpty()) {
            return;
        }
        try {
            int removed = vectorStore.delete(stale);
            log.info("Removed {} vector(s) superseded by {} v{}", removed, current.getDocumentId(), current.getVersion());
        } catch (PipelineException ex) {
            log.warn("Could not remove {} superseded vector(s) of {}", stale.size(), current.getDocumentId(), ex);
        }
    }

    private void failAll(List<QueueDelivery> pending,
                         List<ChunkRecordEntity> records,
                         Map<VersionKey, DocumentVersionEntity> versions,
                         String reason,
                         Set<String> settled) {
        records.forEach(record -> {
            record.setStatus(ChunkStatus.FAILED);
            record.setError(reason);
        });
        chunkRepository.saveAll(records);
        pending.forEach(delivery -> ack(delivery, settled));
        versions.values().forEach(version -> fail(version, reason));
    }

    private void ack(QueueDelivery delivery, Set<String> settled) {
        workQueue.ack(delivery);
        settled.add(delivery.receiptHandle());
    }

    private void nack(QueueDelivery delivery, Set<String> settled) {
        settled.add(delivery.receiptHandle());
        workQueue.nack(delivery);
    }

    private void fail(DocumentVersionEntity version, String reason) {
        if (version == null) {
            return;
        }
        IngestionStates state = IngestionStates.valueOf(version.getStatus());
        if (state == IngestionStates.FAILED || state == IngestionStates.INDEXED || state == IngestionStates.RECEIVED) {
            return;
        }
        version.setError(reason);
        transition(version, IngestionEvents.FAIL);
        countOutcome("failed");
    }

    private void transition(DocumentVersionEntity version, IngestionEvents event) {
        IngestionStates current = IngestionStates.valueOf(version.getStatus());
        IngestionStates next = transitions.apply(version.getDocumentId() + ":" + version.getVersion(), current, event);
        version.setStatus(next.name());
        versionRepository.save(version);
        if (next == IngestionStates.FAILED) {
            log.error("Document {} v{} {} -> {}: {}", version.getDocumentId(), version.getVersion(), current, next, version.getError());
        } else {
            log.info("Document {} v{} {} -> {}", version.getDocumentId(), version.getVersion(), current, next);
        }
    }

    private Map<String, String> payloadFor(ChunkRecordEntity record, DocumentVersionEntity version) {
        Map<String, String> payload = new HashMap<>();
        payload.put(VectorRecord.DOCUMENT_ID, record.getDocumentId());
        payload.put(VectorRecord.VERSION, String.valueOf(record.getVersion()));
        payload.put(VectorRecord.SEQUENCE_INDEX, String.valueOf(record.getSequenceIndex()));
        payload.put(VectorRecord.TEXT, record.getText());
        if (version != null) {
            payload.put(VectorRecord.SOURCE_URI, version.getSourceUri());
        }
        return payload;
    }

    private DocumentStatus toStatus(String documentId, List<DocumentVersionEntity> versions) {
        List<VersionStatus> statuses = versions.stream().map(version -> {
            List<ChunkRecordEntity> chunks = chunkRepository
                    .findByDocumentIdAndVersionOrderBySequenceIndexAsc(documentId, version.getVersion());
            return new VersionStatus(version.getVersion(), version.getStatus(), version.getContentType(), version.getTitle(),
                    version.getChunkCount(),
                    chunkIds(chunks, ChunkStatus.INDEXED),
                    chunkIds(chunks, ChunkStatus.FAILED),
                    version.getError(), version.getCreatedAt(), version.getUpdatedAt());
        }).toList();
        String sourceUri = versions.get(versions.size() - 1).getSourceUri();
        return new DocumentStatus(documentId, sourceUri, statuses);
    }

    private static List<String> chunkIds(List<ChunkRecordEntity> chunks, ChunkStatus status) {
        return chunks.stream()
                .filter(chunk -> chunk.getStatus() == status)
                .map(ChunkRecordEntity::getChunkId)
                .toList();
    }

    private void countOutcome(String outcome) {
        meterRegistry.counter("rag.ingest.events", "outcome", outcome).increment();
    }

    private record VersionKey(String documentId, int version) {}
}
