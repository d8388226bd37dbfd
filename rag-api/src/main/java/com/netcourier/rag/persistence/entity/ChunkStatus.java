package com.netcourier.rag.persistence.entity;

public enum ChunkStatus {
    PENDING,
    INDEXED,
    FAILED
}
