package com.netcourier.rag.service.ingestion;

import com.netcourier.rag.service.ingestion.statemachine.IngestionStates;

public record IngestionOutcome(String documentId,
                               int version,
                               IngestionStates status,
                               int chunks,
                               boolean deduplicated) {
}
