package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.index.IndexSnapshot;
import es.ulpgc.productsearch.indexing.index.TokenIndex;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Selects the documents worth scoring for a query.
 *
 * Candidates are the union of an OR match over every index (title, description and each
 * feature) and an AND match over the title index.
 */
public class CandidateFilter {

    private final IndexSnapshot snapshot;

    public CandidateFilter(IndexSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public Set<String> filter(Collection<String> tokens) {
        Set<String> candidates = new LinkedHashSet<>();
        if (tokens.isEmpty()) return candidates;

        for (TokenIndex index : snapshot.candidateIndexes()) {
            candidates.addAll(filterAny(tokens, index));
        }
        candidates.addAll(filterAll(tokens, snapshot.title()));
        return candidates;
    }

    /** Documents containing at least one of {@code tokens} in {@code index}. */
    public static Set<String> filterAny(Collection<String> tokens, TokenIndex index) {
        Set<String> docs = new LinkedHashSet<>();
        for (String token : tokens) {
            docs.addAll(index.documentsFor(token));
        }
        return docs;
    }

    /**
     * Documents containing every one of {@code tokens} in {@code index}. Empty when
     * {@code tokens} is empty or any token is missing from the index.
     */
    public static Set<String> filterAll(Collection<String> tokens, TokenIndex index) {
        Set<String> docs = null;
        for (String token : tokens) {
            Set<String> matching = index.documentsFor(token);
            if (matching.isEmpty()) return new LinkedHashSet<>();
            if (docs == null) {
                docs = new LinkedHashSet<>(matching);
            } else {
                docs.retainAll(matching);
            }
            if (docs.isEmpty()) break;
        }
        return docs == null ? new LinkedHashSet<>() : docs;
    }
}
