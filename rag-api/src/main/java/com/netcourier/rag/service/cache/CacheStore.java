package com.netcourier.rag.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Query answer cache. Implementations never propagate their own failures: a broken cache reads as a
 * miss and writes become no-ops.
 */
public interface CacheStore {

    /**
     * Returns the entry only while it has not expired.
     */
    Optional<CacheEntry> get(String key);

    /**
     * Stores the entry under its key; the last write wins and its {@code ttl} replaces any previous expiry.
     */
    void put(CacheEntry entry, Duration ttl);
}
