package com.netcourier.rag.persistence.repository;

import com.netcourier.rag.persistence.entity.DocumentVersionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DocumentVersionRepository extends JpaRepository<DocumentVersionEntity, Long> {

    Optional<DocumentVersionEntity> findTopByDocumentIdOrderByVersionDesc(String documentId);

    Optional<DocumentVersionEntity> findByDocumentIdAndVersion(String documentId, Integer version);

    List<DocumentVersionEntity> findByDocumentIdOrderByVersionAsc(String documentId);

    List<DocumentVersionEntity> findAllByOrderByDocumentIdAscVersionAsc();
}
