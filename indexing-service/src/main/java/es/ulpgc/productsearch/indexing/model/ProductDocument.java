package es.ulpgc.productsearch.indexing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A product page loaded from the corpus, keyed by its URL.
 *
 * Only the URL is required. Title and description are absent when the record did not
 * carry them; features and reviews are empty in that case. Instances are immutable.
 */
public final class ProductDocument {

    private final String url;
    private final String title;
    private final String description;
    private final Map<String, String> features;
    private final List<ProductReview> reviews;

    public ProductDocument(String url, String title, String description,
                           Map<String, String> features, List<ProductReview> reviews) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Document url is required");
        }
        this.url = url;
        this.title = title;
        this.description = description;
        this.features = features == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(features));
        this.reviews = reviews == null ? List.of() : List.copyOf(reviews);
    }

    public String getUrl() {
        return url;
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Map<String, String> getFeatures() {
        return features;
    }

    public Optional<String> getFeature(String key) {
        return Optional.ofNullable(features.get(key));
    }

    public List<ProductReview> getReviews() {
        return reviews;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProductDocument other)) return false;
        return url.equals(other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url);
    }

    @Override
    public String toString() {
        return "ProductDocument{" + url + "}";
    }
}
