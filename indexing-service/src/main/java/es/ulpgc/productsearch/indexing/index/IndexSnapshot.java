package es.ulpgc.productsearch.indexing.index;

import es.ulpgc.productsearch.indexing.model.ReviewStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every structure built from one corpus: positional indexes per text field, the
 * review-text index, feature indexes and review statistics.
 *
 * The snapshot is built once and then only read; query components receive it by
 * reference. Review statistics hold one entry per indexed document, so their size is the
 * corpus document count N.
 */
public final class IndexSnapshot {

    public static final String REVIEW_TEXT = "review_text";

    private final Map<TextField, PositionalIndex> fields;
    private final PositionalIndex reviewText;
    private final Map<String, FeatureIndex> features;
    private final Map<String, ReviewStats> reviewStats;

    public IndexSnapshot(Map<TextField, PositionalIndex> fields,
                         PositionalIndex reviewText,
                         Map<String, FeatureIndex> features,
                         Map<String, ReviewStats> reviewStats) {
        EnumMap<TextField, PositionalIndex> all = new EnumMap<>(TextField.class);
        for (TextField field : TextField.values()) {
            all.put(field, fields.getOrDefault(field, PositionalIndex.empty(field.key())));
        }
        this.fields = Collections.unmodifiableMap(all);
        this.reviewText = reviewText == null ? PositionalIndex.empty(REVIEW_TEXT) : reviewText;
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
        this.reviewStats = Collections.unmodifiableMap(new LinkedHashMap<>(reviewStats));
    }

    public PositionalIndex field(TextField field) {
        return fields.get(field);
    }

    public PositionalIndex title() {
        return field(TextField.TITLE);
    }

    public PositionalIndex description() {
        return field(TextField.DESCRIPTION);
    }

    public PositionalIndex reviewText() {
        return reviewText;
    }

    public Map<String, FeatureIndex> features() {
        return features;
    }

    public Optional<FeatureIndex> feature(String name) {
        return Optional.ofNullable(features.get(name));
    }

    public Map<String, ReviewStats> reviewStats() {
        return reviewStats;
    }

    public ReviewStats reviewStats(String url) {
        return reviewStats.getOrDefault(url, ReviewStats.empty());
    }

    public int documentCount() {
        return reviewStats.size();
    }

    /** Indexes searched when collecting candidates: the text fields then every feature. */
    public List<TokenIndex> candidateIndexes() {
        List<TokenIndex> indexes = new ArrayList<>(fields.values());
        indexes.addAll(features.values());
        return indexes;
    }
}
