package com.netcourier.rag.service.query;

import java.util.Locale;
import java.util.regex.Pattern;

public final class QueryNormaliser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryNormaliser() {
    }

    public static String normalise(String query) {
        return query == null ? "" : WHITESPACE.matcher(query.trim()).replaceAll(" ");
    }

    /**
     * Case-folded form used only for the cache key; embedding and generation see the original casing.
     */
    public static String cacheForm(String query) {
        return normalise(query).toLowerCase(Locale.ROOT);
    }
}
