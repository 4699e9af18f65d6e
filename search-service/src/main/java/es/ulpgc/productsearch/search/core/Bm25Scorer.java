package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.index.PositionalIndex;

import java.util.Collection;

/**
 * Okapi BM25 over a single positional index.
 *
 * <pre>
 * idf(t)   = ln((N - df + 0.5) / (df + 0.5) + 1)
 * score(t) = idf(t) * tf * (k1 + 1) / (tf + k1 * (1 - b + b * |d| / avgdl))
 * </pre>
 *
 * N is the corpus document count and avgdl the field length averaged over all N documents.
 */
public class Bm25Scorer {

    public static final double DEFAULT_K1 = 1.5;
    public static final double DEFAULT_B = 0.75;

    private final double k1;
    private final double b;

    public Bm25Scorer() {
        this(DEFAULT_K1, DEFAULT_B);
    }

    public Bm25Scorer(double k1, double b) {
        this.k1 = k1;
        this.b = b;
    }

    public double idf(int documentFrequency, int documentCount) {
        return Math.log((documentCount - documentFrequency + 0.5) / (documentFrequency + 0.5) + 1);
    }

    public double termScore(int tf, int documentFrequency, int documentLength, double avgdl, int documentCount) {
        if (tf <= 0) return 0.0;
        double norm = tf + k1 * (1 - b + b * documentLength / avgdl);
        return idf(documentFrequency, documentCount) * (tf * (k1 + 1)) / norm;
    }

    public static double averageLength(PositionalIndex index, int documentCount) {
        return documentCount == 0 ? 0.0 : (double) index.totalLength() / documentCount;
    }

    /** BM25 of one document; 0 when the field has no tokens in the corpus. */
    public double score(String url, Collection<String> tokens, PositionalIndex index, int documentCount) {
        double avgdl = averageLength(index, documentCount);
        if (avgdl == 0.0) return 0.0;

        double score = 0.0;
        for (String token : tokens) {
            int tf = index.termFrequency(token, url);
            if (tf == 0) continue;
            score += termScore(tf, index.documentFrequency(token), index.fieldLength(url), avgdl, documentCount);
        }
        return score;
    }
}
