package es.ulpgc.productsearch.indexing.model;

import java.util.Optional;

/**
 * One customer review as it appears in the corpus. Rating and date may be missing.
 */
public final class ProductReview {

    private final Integer rating;
    private final String date;
    private final String text;

    public ProductReview(Integer rating, String date, String text) {
        this.rating = rating;
        this.date = date;
        this.text = text == null ? "" : text;
    }

    public Optional<Integer> getRating() {
        return Optional.ofNullable(rating);
    }

    public Optional<String> getDate() {
        return Optional.ofNullable(date);
    }

    public String getText() {
        return text;
    }
}
