package com.netcourier.rag.service.ingestion;

public record ExtractedText(String text, String contentType, String title) {
}
