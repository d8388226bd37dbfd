package com.netcourier.rag.service.ingestion;

import com.netcourier.rag.model.DocumentStatus;
import com.netcourier.rag.service.queue.ChunkWorkItem;
import com.netcourier.rag.service.queue.QueueDelivery;

import java.util.List;

public interface IngestionCoordinator {

    IngestionOutcome ingest(String bucket, String key);

    DeliveryOutcome handleDeliveries(List<QueueDelivery> deliveries);

    void onDeadLetter(ChunkWorkItem item);

    IngestionOutcome retry(String documentId, int version);

    DocumentStatus status(String documentId);

    List<DocumentStatus> listDocuments();
}
