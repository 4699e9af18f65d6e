package es.ulpgc.productsearch.indexing.index;

import es.ulpgc.productsearch.indexing.model.ProductDocument;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Text fields that get a positional index of their own.
 */
public enum TextField {
    TITLE("title", ProductDocument::getTitle),
    DESCRIPTION("description", ProductDocument::getDescription);

    private final String key;
    private final Function<ProductDocument, Optional<String>> selector;

    TextField(String key, Function<ProductDocument, Optional<String>> selector) {
        this.key = key;
        this.selector = selector;
    }

    public String key() {
        return key;
    }

    public Optional<String> select(ProductDocument document) {
        return selector.apply(document);
    }

    public static TextField fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.key.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown text field: " + key));
    }
}
