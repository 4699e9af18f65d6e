package es.ulpgc.productsearch.indexing.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Positional inverted index for one text field: token -> url -> positions.
 *
 * Positions are 0-based offsets in the tokenized field and strictly increasing per
 * (token, url). Field lengths are the number of tokens recorded for a document, so they
 * can be recovered from the postings alone. Instances are created through {@link Builder}
 * or {@link #fromPostings} and are read-only afterwards.
 */
public final class PositionalIndex implements TokenIndex {

    private final String name;
    private final Map<String, Map<String, List<Integer>>> postings;
    private final Map<String, Integer> fieldLengths;
    private final long totalLength;

    private PositionalIndex(String name, Map<String, Map<String, List<Integer>>> postings) {
        this.name = name;

        Map<String, Map<String, List<Integer>>> frozen = new LinkedHashMap<>();
        Map<String, Integer> lengths = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<String, Map<String, List<Integer>>> byToken : postings.entrySet()) {
            Map<String, List<Integer>> docs = new LinkedHashMap<>();
            for (Map.Entry<String, List<Integer>> byDoc : byToken.getValue().entrySet()) {
                List<Integer> positions = List.copyOf(byDoc.getValue());
                docs.put(byDoc.getKey(), positions);
                lengths.merge(byDoc.getKey(), positions.size(), Integer::sum);
                total += positions.size();
            }
            frozen.put(byToken.getKey(), Collections.unmodifiableMap(docs));
        }
        this.postings = Collections.unmodifiableMap(frozen);
        this.fieldLengths = Collections.unmodifiableMap(lengths);
        this.totalLength = total;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static PositionalIndex empty(String name) {
        return new PositionalIndex(name, Map.of());
    }

    /** Rebuilds an index from its serialized form, validating the position lists. */
    public static PositionalIndex fromPostings(String name, Map<String, Map<String, List<Integer>>> postings) {
        for (Map.Entry<String, Map<String, List<Integer>>> byToken : postings.entrySet()) {
            if (byToken.getKey() == null || byToken.getValue() == null) {
                throw new IllegalArgumentException("Null postings for token '" + byToken.getKey() + "'");
            }
            for (Map.Entry<String, List<Integer>> byDoc : byToken.getValue().entrySet()) {
                if (byDoc.getKey() == null || byDoc.getValue() == null) {
                    throw new IllegalArgumentException(
                            "Null positions for '" + byToken.getKey() + "' in " + byDoc.getKey());
                }
                requireIncreasing(byToken.getKey(), byDoc.getKey(), byDoc.getValue());
            }
        }
        return new PositionalIndex(name, postings);
    }

    private static void requireIncreasing(String token, String url, List<Integer> positions) {
        int previous = -1;
        for (Integer p : positions) {
            if (p == null || p <= previous) {
                throw new IllegalArgumentException(
                        "Positions for '" + token + "' in " + url + " are not strictly increasing: " + positions);
            }
            previous = p;
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> documentsFor(String token) {
        return postings(token).keySet();
    }

    @Override
    public Set<String> vocabulary() {
        return postings.keySet();
    }

    public Map<String, List<Integer>> postings(String token) {
        return postings.getOrDefault(token, Map.of());
    }

    public List<Integer> positions(String token, String url) {
        return postings(token).getOrDefault(url, List.of());
    }

    public int termFrequency(String token, String url) {
        return positions(token, url).size();
    }

    public int documentFrequency(String token) {
        return postings(token).size();
    }

    /** Tokenized length of the field for {@code url}; 0 when the document has no tokens there. */
    public int fieldLength(String url) {
        return fieldLengths.getOrDefault(url, 0);
    }

    public long totalLength() {
        return totalLength;
    }

    public Map<String, Map<String, List<Integer>>> asMap() {
        return postings;
    }

    public static final class Builder {
        private final String name;
        private final Map<String, Map<String, List<Integer>>> postings = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /** Records every token of one document's field at its offset in {@code tokens}. */
        public Builder add(String url, List<String> tokens) {
            for (int i = 0; i < tokens.size(); i++) {
                postings.computeIfAbsent(tokens.get(i), t -> new LinkedHashMap<>())
                        .computeIfAbsent(url, u -> new ArrayList<>())
                        .add(i);
            }
            return this;
        }

        public PositionalIndex build() {
            return new PositionalIndex(name, postings);
        }
    }
}
