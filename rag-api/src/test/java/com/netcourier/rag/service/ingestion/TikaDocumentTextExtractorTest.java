package com.netcourier.rag.service.ingestion;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TikaDocumentTextExtractorTest {

    private final TikaDocumentTextExtractor extractor = new TikaDocumentTextExtractor();

    @Test
    void extractsAndCleansPlainText() {
        byte[] content = "Shipping policy\n\nOrders ship   within two days.".getBytes(StandardCharsets.UTF_8);

        ExtractedText extracted = extractor.extract("uploads/policy.txt", "text/plain", content);

        assertThat(extracted.text()).isEqualTo("Shipping policy Orders ship within two days.");
        assertThat(extracted.contentType()).startsWith("text/plain");
    }

    @Test
    void rejectsEmptyContent() {
        assertThatThrownBy(() -> extractor.extract("uploads/empty.txt", "text/plain", new byte[0]))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void rejectsBinaryImages() {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R'};

        assertThatThrownBy(() -> extractor.extract("uploads/scan.png", null, png))
                .isInstanceOf(UnsupportedFormatException.class);
    }
}
