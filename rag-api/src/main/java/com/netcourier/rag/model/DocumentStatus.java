package com.netcourier.rag.model;

import java.util.List;

public record DocumentStatus(String documentId, String sourceUri, List<VersionStatus> versions) {
}
