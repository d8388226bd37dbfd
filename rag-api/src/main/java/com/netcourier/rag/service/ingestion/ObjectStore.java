package com.netcourier.rag.service.ingestion;

/**
 * Bucket/key addressed blob storage that uploaded documents are read from.
 */
public interface ObjectStore {

    StoredObject fetch(String bucket, String key);

    void store(String bucket, String key, byte[] content, String contentType);
}
