package com.netcourier.rag.service.ingestion;

import org.apache.commons.io.FilenameUtils;

import java.util.Locale;
import java.util.Map;

final class FileTypes {

    private static final Map<String, String> BY_EXTENSION = Map.of(
            "pdf", "application/pdf",
            "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "doc", "application/msword",
            "txt", "text/plain",
            "md", "text/markdown",
            "html", "text/html",
            "htm", "text/html");

    private FileTypes() {
    }

    /**
     * Content type implied by the key's extension; keys without a known extension are read as plain text.
     */
    static String fromKey(String key) {
        String extension = FilenameUtils.getExtension(key).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, "text/plain");
    }
}
