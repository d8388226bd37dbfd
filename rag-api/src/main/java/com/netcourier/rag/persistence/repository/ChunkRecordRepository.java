package com.netcourier.rag.persistence.repository;

import com.netcourier.rag.persistence.entity.ChunkRecordEntity;
import com.netcourier.rag.persistence.entity.ChunkStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ChunkRecordRepository extends JpaRepository<ChunkRecordEntity, Long> {

    List<ChunkRecordEntity> findByDocumentIdAndVersionOrderBySequenceIndexAsc(String documentId, Integer version);

    Optional<ChunkRecordEntity> findByDocumentIdAndVersionAndSequenceIndex(String documentId, Integer version, Integer sequenceIndex);

    long countByDocumentIdAndVersionAndStatus(String documentId, Integer version, ChunkStatus status);
}
