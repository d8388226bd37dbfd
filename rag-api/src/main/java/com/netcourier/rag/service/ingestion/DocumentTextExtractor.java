package com.netcourier.rag.service.ingestion;

public interface DocumentTextExtractor {

    ExtractedText extract(String filename, String contentType, byte[] content);
}
