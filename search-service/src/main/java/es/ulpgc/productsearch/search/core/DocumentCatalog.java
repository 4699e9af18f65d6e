package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.model.ProductDocument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Display data (title, description) per URL, used to present hits.
 */
public final class DocumentCatalog {

    public static final class Entry {
        private final String title;
        private final String description;

        Entry(String title, String description) {
            this.title = title;
            this.description = description;
        }

        public String getTitle() {
            return title;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Map<String, Entry> entries;

    private DocumentCatalog(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static DocumentCatalog of(List<ProductDocument> documents) {
        Map<String, Entry> entries = new LinkedHashMap<>();
        for (ProductDocument doc : documents) {
            entries.put(doc.getUrl(), new Entry(
                    doc.getTitle().orElse(""),
                    doc.getDescription().orElse("")));
        }
        return new DocumentCatalog(entries);
    }

    public Optional<Entry> get(String url) {
        return Optional.ofNullable(entries.get(url));
    }

    public int size() {
        return entries.size();
    }
}
