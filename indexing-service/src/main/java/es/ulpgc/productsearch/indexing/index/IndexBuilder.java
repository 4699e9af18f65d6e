package es.ulpgc.productsearch.indexing.index;

import es.ulpgc.productsearch.indexing.model.ProductDocument;
import es.ulpgc.productsearch.indexing.model.ProductReview;
import es.ulpgc.productsearch.indexing.model.ReviewStats;
import es.ulpgc.productsearch.indexing.util.TextTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds an {@link IndexSnapshot} from a document collection.
 *
 * The build is deterministic: the same documents in the same order give structurally
 * identical indexes.
 */
public class IndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    /** Indexes title and description plus every feature key found in the corpus. */
    public IndexSnapshot build(List<ProductDocument> documents) {
        return build(documents, EnumSet.allOf(TextField.class), List.of());
    }

    /**
     * @param fields      text fields that get a positional index
     * @param featureKeys feature keys to index; empty means every key present in the corpus
     */
    public IndexSnapshot build(List<ProductDocument> documents, Set<TextField> fields,
                               Collection<String> featureKeys) {
        Collection<String> keys = featureKeys == null || featureKeys.isEmpty()
                ? discoverFeatureKeys(documents)
                : featureKeys;

        Map<TextField, PositionalIndex> positional = new EnumMap<>(TextField.class);
        for (TextField field : fields) {
            positional.put(field, buildFieldIndex(documents, field));
        }

        Map<String, FeatureIndex> features = new LinkedHashMap<>();
        for (String key : keys) {
            features.put(key, buildFeatureIndex(documents, key));
        }

        IndexSnapshot snapshot = new IndexSnapshot(
                positional,
                buildReviewTextIndex(documents),
                features,
                buildReviewStats(documents)
        );
        log.info("Indexed {} documents: fields={}, features={}",
                snapshot.documentCount(), positional.keySet(), features.keySet());
        return snapshot;
    }

    PositionalIndex buildFieldIndex(List<ProductDocument> documents, TextField field) {
        PositionalIndex.Builder builder = PositionalIndex.builder(field.key());
        for (ProductDocument doc : documents) {
            Optional<String> text = field.select(doc);
            text.ifPresent(t -> builder.add(doc.getUrl(), TextTokenizer.tokens(t)));
        }
        return builder.build();
    }

    /** Review texts of a document are tokenized in list order and indexed as one sequence. */
    PositionalIndex buildReviewTextIndex(List<ProductDocument> documents) {
        PositionalIndex.Builder builder = PositionalIndex.builder(IndexSnapshot.REVIEW_TEXT);
        for (ProductDocument doc : documents) {
            List<String> tokens = new ArrayList<>();
            for (ProductReview review : doc.getReviews()) {
                tokens.addAll(TextTokenizer.tokens(review.getText()));
            }
            builder.add(doc.getUrl(), tokens);
        }
        return builder.build();
    }

    FeatureIndex buildFeatureIndex(List<ProductDocument> documents, String key) {
        FeatureIndex.Builder builder = FeatureIndex.builder(key);
        for (ProductDocument doc : documents) {
            doc.getFeature(key).ifPresent(value -> builder.add(doc.getUrl(), TextTokenizer.tokens(value)));
        }
        return builder.build();
    }

    Map<String, ReviewStats> buildReviewStats(List<ProductDocument> documents) {
        Map<String, ReviewStats> stats = new LinkedHashMap<>();
        for (ProductDocument doc : documents) {
            stats.put(doc.getUrl(), ReviewStats.of(doc.getReviews()));
        }
        return stats;
    }

    static List<String> discoverFeatureKeys(List<ProductDocument> documents) {
        Set<String> keys = new LinkedHashSet<>();
        for (ProductDocument doc : documents) {
            keys.addAll(doc.getFeatures().keySet());
        }
        return new ArrayList<>(keys);
    }
}
