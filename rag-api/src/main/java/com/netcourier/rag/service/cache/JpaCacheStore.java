package com.netcourier.rag.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.rag.model.SourceReference;
import com.netcourier.rag.persistence.entity.QueryCacheEntity;
import com.netcourier.rag.persistence.repository.QueryCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cache rows shared by every service instance pointing at the same database.
 */
@Component
@ConditionalOnProperty(prefix = "rag.cache", name = "backend", havingValue = "jpa")
public class JpaCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCacheStore.class);
    private static final TypeReference<List<SourceReference>> SOURCES = new TypeReference<>() {
    };

    private final QueryCacheRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaCacheStore(QueryCacheRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        try {
            return repository.findById(key)
                    .filter(entity -> clock.instant().isBefore(entity.getExpiresAt()))
                    .map(this::toEntry);
        } catch (DataAccessException | IllegalStateException e) {
            log.warn("Cache lookup for {} failed, treating as miss", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        Instant now = clock.instant();
        try {
            QueryCacheEntity entity = repository.findById(entry.cacheKey())
                    .orElseGet(() -> new QueryCacheEntity(entry.cacheKey()));
            entity.setNormalizedQuery(entry.normalizedQuery());
            entity.setTopK(entry.topK());
            entity.setAnswer(entry.answer());
            entity.setSourcesJson(objectMapper.writeValueAsString(entry.sources()));
            entity.setUnsupportedByContext(entry.unsupportedByContext());
            entity.setCreatedAt(now);
            entity.setExpiresAt(now.plus(ttl));
            repository.save(entity);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Unable to cache answer under {}", entry.cacheKey(), e);
        }
    }

    @Scheduled(fixedDelayString = "${rag.cache.purge-interval-ms:600000}")
    @Transactional
    public void purgeExpired() {
        try {
            int removed = repository.deleteExpired(clock.instant());
            if (removed > 0) {
                log.debug("Purged {} expired cache rows", removed);
            }
        } catch (DataAccessException e) {
            log.warn("Cache purge failed", e);
        }
    }

    private CacheEntry toEntry(QueryCacheEntity entity) {
        List<SourceReference> sources;
        try {
            sources = entity.getSourcesJson() == null ? List.of() : objectMapper.readValue(entity.getSourcesJson(), SOURCES);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache row " + entity.getCacheKey(), e);
        }
        return new CacheEntry(entity.getCacheKey(), entity.getNormalizedQuery(), entity.getTopK(), entity.getAnswer(),
                sources, Boolean.TRUE.equals(entity.getUnsupportedByContext()), entity.getCreatedAt(), entity.getExpiresAt());
    }
}
