package com.netcourier.rag.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.OffsetDateTime;

@Entity
@Table(name = "chunk_records",
        uniqueConstraints = @UniqueConstraint(columnNames = {"document_id", "version", "sequence_index"}))
public class ChunkRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "chunk_id", nullable = false, length = 36)
    private String chunkId;

    @Column(name = "document_id", nullable = false, length = 64)
    private String documentId;

    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "sequence_index", nullable = false)
    private Integer sequenceIndex;

    @Column(name = "chunk_text", nullable = false, columnDefinition = "text")
    private String text;

    @Column(name = "char_start", nullable = false)
    private Integer charStart;

    @Column(name = "char_end", nullable = false)
    private Integer charEnd;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ChunkStatus status;

    @Column(nullable = false)
    private Integer attempts;

    @Column(columnDefinition = "text")
    private String error;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected ChunkRecordEntity() {
    }

    public ChunkRecordEntity(String chunkId, String documentId, Integer version, Integer sequenceIndex,
                             String text, Integer charStart, Integer charEnd, String contentHash) {
        this.chunkId = chunkId;
        this.documentId = documentId;
        this.version = version;
        this.sequenceIndex = sequenceIndex;
        this.text = text;
        this.charStart = charStart;
        this.charEnd = charEnd;
        this.contentHash = contentHash;
        this.status = ChunkStatus.PENDING;
        this.attempts = 0;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = OffsetDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public String getChunkId() {
        return chunkId;
    }

    public String getDocumentId() {
        return documentId;
    }

    public Integer getVersion() {
        return version;
    }

    public Integer getSequenceIndex() {
        return sequenceIndex;
    }

    public String getText() {
        return text;
    }

    public Integer getCharStart() {
        return charStart;
    }

    public Integer getCharEnd() {
        return charEnd;
    }

    public String getContentHash() {
        return contentHash;
    }

    public ChunkStatus getStatus() {
        return status;
    }

    public void setStatus(ChunkStatus status) {
        this.status = status;
    }

    public Integer getAttempts() {
        return attempts;
    }

    public void setAttempts(Integer attempts) {
        this.attempts = attempts;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
