package es.ulpgc.productsearch.indexing.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Review aggregates for one document.
 *
 * {@code meanMark} is undefined when the document has no rated review, and {@code lastRating}
 * is the rating of the last review in the list as given (not the most recent by date).
 */
public final class ReviewStats {

    @SerializedName("total_reviews")
    private final int totalReviews;

    @SerializedName("mean_mark")
    private final Double meanMark;

    @SerializedName("last_rating")
    private final Integer lastRating;

    public ReviewStats(int totalReviews, Double meanMark, Integer lastRating) {
        if (totalReviews < 0) throw new IllegalArgumentException("totalReviews < 0");
        this.totalReviews = totalReviews;
        this.meanMark = meanMark;
        this.lastRating = lastRating;
    }

    public static ReviewStats empty() {
        return new ReviewStats(0, null, null);
    }

    public static ReviewStats of(List<ProductReview> reviews) {
        if (reviews == null || reviews.isEmpty()) return empty();

        int sum = 0;
        int rated = 0;
        for (ProductReview review : reviews) {
            Optional<Integer> rating = review.getRating();
            if (rating.isPresent()) {
                sum += rating.get();
                rated++;
            }
        }
        Double mean = rated == 0 ? null : (double) sum / rated;
        Integer last = reviews.get(reviews.size() - 1).getRating().orElse(null);
        return new ReviewStats(reviews.size(), mean, last);
    }

    public int getTotalReviews() {
        return totalReviews;
    }

    public OptionalDouble getMeanMark() {
        return meanMark == null ? OptionalDouble.empty() : OptionalDouble.of(meanMark);
    }

    public Optional<Integer> getLastRating() {
        return Optional.ofNullable(lastRating);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReviewStats other)) return false;
        return totalReviews == other.totalReviews
                && Objects.equals(meanMark, other.meanMark)
                && Objects.equals(lastRating, other.lastRating);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalReviews, meanMark, lastRating);
    }

    @Override
    public String toString() {
        return "ReviewStats{total=" + totalReviews + ", mean=" + meanMark + ", last=" + lastRating + "}";
    }
}
