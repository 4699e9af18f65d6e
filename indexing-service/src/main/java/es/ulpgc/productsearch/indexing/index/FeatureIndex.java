package es.ulpgc.productsearch.indexing.index;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Inverted index for one product feature (brand, origin, ...): token -> set of URLs.
 */
public final class FeatureIndex implements TokenIndex {

    private final String name;
    private final Map<String, Set<String>> postings;

    private FeatureIndex(String name, Map<String, ? extends Collection<String>> postings) {
        this.name = name;
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        postings.forEach((token, urls) ->
                frozen.put(token, Collections.unmodifiableSet(new LinkedHashSet<>(urls))));
        this.postings = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Rebuilds an index from its serialized form; null tokens, URL lists or URLs are rejected. */
    public static FeatureIndex fromPostings(String name, Map<String, ? extends Collection<String>> postings) {
        postings.forEach((token, urls) -> {
            if (token == null || urls == null || urls.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Null entry for token '" + token + "' in feature " + name);
            }
        });
        return new FeatureIndex(name, postings);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> documentsFor(String token) {
        return postings.getOrDefault(token, Set.of());
    }

    @Override
    public Set<String> vocabulary() {
        return postings.keySet();
    }

    public Map<String, Set<String>> asMap() {
        return postings;
    }

    public static final class Builder {
        private final String name;
        private final Map<String, Set<String>> postings = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder add(String url, Collection<String> tokens) {
            for (String token : tokens) {
                postings.computeIfAbsent(token, t -> new LinkedHashSet<>()).add(url);
            }
            return this;
        }

        public FeatureIndex build() {
            return new FeatureIndex(name, postings);
        }
    }
}
