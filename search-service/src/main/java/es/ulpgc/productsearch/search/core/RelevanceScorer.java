package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.index.IndexSnapshot;

import java.util.Collection;

/**
 * Computes the combined ranking score of a candidate, plus BM25 over title and
 * description as a diagnostic.
 *
 * <pre>
 * score = 3   * title occurrences
 *       + 1   * description occurrences
 *       + 0.5 * review-text occurrences
 *       + 5   if every query token is in the title
 *       + 0.1 * total reviews
 * </pre>
 *
 * Occurrences are summed term frequencies, not presence flags.
 */
public class RelevanceScorer {

    private final IndexSnapshot snapshot;
    private final ScoringWeights weights;
    private final Bm25Scorer bm25;

    public RelevanceScorer(IndexSnapshot snapshot) {
        this(snapshot, ScoringWeights.DEFAULT, new Bm25Scorer());
    }

    public RelevanceScorer(IndexSnapshot snapshot, ScoringWeights weights, Bm25Scorer bm25) {
        this.snapshot = snapshot;
        this.weights = weights;
        this.bm25 = bm25;
    }

    public double computeScore(String url, Collection<String> tokens) {
        return breakdown(url, tokens).total(weights);
    }

    public ScoreBreakdown breakdown(String url, Collection<String> tokens) {
        int title = 0;
        int description = 0;
        int review = 0;
        boolean covered = !tokens.isEmpty();

        for (String token : tokens) {
            int inTitle = snapshot.title().termFrequency(token, url);
            if (inTitle == 0) covered = false;
            title += inTitle;
            description += snapshot.description().termFrequency(token, url);
            review += snapshot.reviewText().termFrequency(token, url);
        }
        return new ScoreBreakdown(title, description, review, covered,
                snapshot.reviewStats(url).getTotalReviews());
    }

    public double bm25(String url, Collection<String> tokens) {
        int n = snapshot.documentCount();
        return bm25.score(url, tokens, snapshot.title(), n)
                + bm25.score(url, tokens, snapshot.description(), n);
    }
}
