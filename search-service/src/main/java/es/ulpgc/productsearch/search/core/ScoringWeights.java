package es.ulpgc.productsearch.search.core;

/**
 * Weights of the combined ranking score.
 */
public final class ScoringWeights {

    public static final double TITLE_OCCURRENCE = 3.0;
    public static final double DESCRIPTION_OCCURRENCE = 1.0;
    public static final double REVIEW_OCCURRENCE = 0.5;
    public static final double FULL_TITLE_COVERAGE_BONUS = 5.0;
    public static final double PER_REVIEW = 0.1;

    public static final ScoringWeights DEFAULT = new ScoringWeights(
            TITLE_OCCURRENCE, DESCRIPTION_OCCURRENCE, REVIEW_OCCURRENCE, FULL_TITLE_COVERAGE_BONUS, PER_REVIEW);

    private final double title;
    private final double description;
    private final double review;
    private final double fullTitleCoverage;
    private final double perReview;

    public ScoringWeights(double title, double description, double review,
                          double fullTitleCoverage, double perReview) {
        this.title = title;
        this.description = description;
        this.review = review;
        this.fullTitleCoverage = fullTitleCoverage;
        this.perReview = perReview;
    }

    public double title() {
        return title;
    }

    public double description() {
        return description;
    }

    public double review() {
        return review;
    }

    public double fullTitleCoverage() {
        return fullTitleCoverage;
    }

    public double perReview() {
        return perReview;
    }
}
