package com.netcourier.rag.service.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "rag.cache", name = "backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isLiveAt(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        Instant now = clock.instant();
        entries.put(entry.cacheKey(), entry.withLifetime(now, now.plus(ttl)));
    }

    @Scheduled(fixedDelayString = "${rag.cache.purge-interval-ms:600000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isLiveAt(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Purged {} expired cache entries", removed);
        }
    }

    int size() {
        return entries.size();
    }
}
