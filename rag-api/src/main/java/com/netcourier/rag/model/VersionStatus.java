package com.netcourier.rag.model;

import java.time.OffsetDateTime;
import java.util.List;

public record VersionStatus(int version,
                            String status,
                            String contentType,
                            String title,
                            int chunkCount,
                            List<String> indexedChunkIds,
                            List<String> failedChunkIds,
                            String error,
                            OffsetDateTime createdAt,
                            OffsetDateTime updatedAt) {
}
