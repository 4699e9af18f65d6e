package es.ulpgc.productsearch.search.core;

/**
 * A candidate URL with its combined score and BM25 diagnostic, before display data is attached.
 */
public record ScoredDocument(String url, double score, double bm25) {

    public double scoreFor(RankingMode mode) {
        return mode == RankingMode.BM25 ? bm25 : score;
    }
}
