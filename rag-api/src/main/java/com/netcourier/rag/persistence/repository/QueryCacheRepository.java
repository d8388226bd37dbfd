package com.netcourier.rag.persistence.repository;

import com.netcourier.rag.persistence.entity.QueryCacheEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface QueryCacheRepository extends JpaRepository<QueryCacheEntity, String> {

    @Modifying
    @Query("delete from QueryCacheEntity c where c.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
