package com.netcourier.rag.service.ingestion;

public record StoredObject(String bucket, String key, byte[] content, String contentType) {

    public String uri() {
        return "s3://" + bucket + "/" + key;
    }
}
