package com.netcourier.rag.service.cache;

import com.netcourier.rag.model.SourceReference;

import java.time.Instant;
import java.util.List;

public record CacheEntry(String cacheKey,
                         String normalizedQuery,
                         int topK,
                         String answer,
                         List<SourceReference> sources,
                         boolean unsupportedByContext,
                         Instant createdAt,
                         Instant expiresAt) {

    public CacheEntry {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public List<String> retrievedChunkIds() {
        return sources.stream().map(SourceReference::chunkId).toList();
    }

    public boolean isLiveAt(Instant now) {
        return expiresAt != null && now.isBefore(expiresAt);
    }

    CacheEntry withLifetime(Instant created, Instant expires) {
        return new CacheEntry(cacheKey, normalizedQuery, topK, answer, sources, unsupportedByContext, created, expires);
    }
}
