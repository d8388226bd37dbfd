package com.netcourier.rag.service.queue;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.netcourier.rag.service.ingestion.Chunk;

/**
 * Queue message asking for one chunk to be embedded and indexed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChunkWorkItem(String documentId,
                            int version,
                            String chunkId,
                            int sequenceIndex,
                            String text,
                            int charStart,
                            int charEnd) {

    public static ChunkWorkItem of(Chunk chunk) {
        return new ChunkWorkItem(chunk.documentId(), chunk.version(), chunk.chunkId(), chunk.sequenceIndex(),
                chunk.text(), chunk.charStart(), chunk.charEnd());
    }
}
