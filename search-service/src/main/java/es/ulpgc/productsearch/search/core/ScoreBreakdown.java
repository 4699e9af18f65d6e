package es.ulpgc.productsearch.search.core;

/**
 * Raw counts behind a combined score, kept so the score can be recomputed and explained.
 */
public final class ScoreBreakdown {

    private final int titleOccurrences;
    private final int descriptionOccurrences;
    private final int reviewOccurrences;
    private final boolean fullTitleCoverage;
    private final int totalReviews;

    public ScoreBreakdown(int titleOccurrences, int descriptionOccurrences, int reviewOccurrences,
                          boolean fullTitleCoverage, int totalReviews) {
        this.titleOccurrences = titleOccurrences;
        this.descriptionOccurrences = descriptionOccurrences;
        this.reviewOccurrences = reviewOccurrences;
        this.fullTitleCoverage = fullTitleCoverage;
        this.totalReviews = totalReviews;
    }

    public double total(ScoringWeights weights) {
        double score = weights.title() * titleOccurrences
                + weights.description() * descriptionOccurrences
                + weights.review() * reviewOccurrences;
        if (fullTitleCoverage) score += weights.fullTitleCoverage();
        return score + weights.perReview() * totalReviews;
    }

    public int getTitleOccurrences() {
        return titleOccurrences;
    }

    public int getDescriptionOccurrences() {
        return descriptionOccurrences;
    }

    public int getReviewOccurrences() {
        return reviewOccurrences;
    }

    public boolean isFullTitleCoverage() {
        return fullTitleCoverage;
    }

    public int getTotalReviews() {
        return totalReviews;
    }
}
