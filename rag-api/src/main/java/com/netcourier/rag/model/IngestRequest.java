package com.netcourier.rag.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Object-created notification: the bucket may be omitted to use the configured default.
 */
public record IngestRequest(String bucket, @NotBlank String key) {
}
