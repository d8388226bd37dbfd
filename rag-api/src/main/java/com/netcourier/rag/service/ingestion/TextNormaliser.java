package com.netcourier.rag.service.ingestion;

import java.util.regex.Pattern;

public final class TextNormaliser {

    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f\\x7f-\\x9f]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormaliser() {
    }

    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = CONTROL_CHARACTERS.matcher(text).replaceAll("");
        cleaned = cleaned.replace('“', '"')
                .replace('”', '"')
                .replace('‘', '\'')
                .replace('’', '\'');
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }
}
