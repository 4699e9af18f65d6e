package es.ulpgc.productsearch.search.core;

import java.util.Locale;

/**
 * Which score orders the results. COMBINED is the production order.
 */
public enum RankingMode {
    COMBINED,
    BM25;

    public static RankingMode fromParam(String value) {
        if (value == null || value.isBlank()) return COMBINED;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ranking mode: " + value, e);
        }
    }
}
