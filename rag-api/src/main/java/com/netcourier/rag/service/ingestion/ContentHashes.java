package com.netcourier.rag.service.ingestion;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

public final class ContentHashes {

    private ContentHashes() {
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder();
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Name-based UUID so the id is accepted as a point id by every vector backend.
     */
    public static String chunkId(String documentId, String contentHash, int sequenceIndex) {
        String name = documentId + ":" + contentHash + ":" + sequenceIndex;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static String documentId(String bucket, String key) {
        return sha256(bucket + "/" + key).substring(0, 16);
    }
}
