package com.netcourier.rag.service.ingestion;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormaliserTest {

    @Test
    void stripsControlCharactersAndCollapsesWhitespace() {
        String raw = "  Line one\u0000\u0007 continues\n\n\tLine   two \u001F ";

        assertThat(TextNormaliser.clean(raw)).isEqualTo("Line one continues Line two");
    }

    @Test
    void normalisesCurlyQuotes() {
        assertThat(TextNormaliser.clean("“Quoted” and ‘single’"))
                .isEqualTo("\"Quoted\" and 'single'");
    }

    @Test
    void treatsNullAsEmpty() {
        assertThat(TextNormaliser.clean(null)).isEmpty();
    }
}
