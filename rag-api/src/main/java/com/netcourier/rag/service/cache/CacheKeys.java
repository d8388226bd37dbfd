package com.netcourier.rag.service.cache;

import com.netcourier.rag.service.ingestion.ContentHashes;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class CacheKeys {

    private CacheKeys() {
    }

    public static String key(String normalizedQuery, int topK, String modelVersion, Map<String, String> filters) {
        StringBuilder material = new StringBuilder()
                .append(normalizedQuery)
                .append('|').append(topK)
                .append('|').append(modelVersion);
        if (filters != null && !filters.isEmpty()) {
            String canonical = new TreeMap<>(filters).entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining("&"));
            material.append('|').append(canonical);
        }
        return ContentHashes.sha256(material.toString());
    }
}
