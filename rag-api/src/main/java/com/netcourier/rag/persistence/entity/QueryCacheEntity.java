package com.netcourier.rag.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "query_cache")
public class QueryCacheEntity {

    @Id
    @Column(name = "cache_key", length = 64)
    private String cacheKey;

    @Column(name = "normalized_query", nullable = false, columnDefinition = "text")
    private String normalizedQuery;

    @Column(name = "top_k", nullable = false)
    private Integer topK;

    @Column(columnDefinition = "text")
    private String answer;

    @Column(name = "sources_json", columnDefinition = "text")
    private String sourcesJson;

    @Column(name = "unsupported_by_context", nullable = false)
    private Boolean unsupportedByContext;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected QueryCacheEntity() {
    }

    public QueryCacheEntity(String cacheKey) {
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public String getNormalizedQuery() {
        return normalizedQuery;
    }

    public void setNormalizedQuery(String normalizedQuery) {
        this.normalizedQuery = normalizedQuery;
    }

    public Integer getTopK() {
        return topK;
    }

    public void setTopK(Integer topK) {
        this.topK = topK;
    }

    public String getAnswer() {
        return answer;
    }

    public void setAnswer(String answer) {
        this.answer = answer;
    }

    public String getSourcesJson() {
        return sourcesJson;
    }

    public void setSourcesJson(String sourcesJson) {
        this.sourcesJson = sourcesJson;
    }

    public Boolean getUnsupportedByContext() {
        return unsupportedByContext;
    }

    public void setUnsupportedByContext(Boolean unsupportedByContext) {
        this.unsupportedByContext = unsupportedByContext;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
