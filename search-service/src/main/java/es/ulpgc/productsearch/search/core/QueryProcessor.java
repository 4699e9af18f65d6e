package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.util.TextTokenizer;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a raw query into the token set used for filtering and scoring:
 * tokenize, normalize, then expand with synonyms.
 */
public class QueryProcessor {

    private final SynonymTable synonyms;

    public QueryProcessor(SynonymTable synonyms) {
        this.synonyms = synonyms;
    }

    public Set<String> process(String rawQuery) {
        return expand(normalize(tokenize(rawQuery)));
    }

    List<String> tokenize(String rawQuery) {
        return TextTokenizer.tokens(rawQuery);
    }

    // Stopwords are already gone after tokenize; stemming would go here.
    List<String> normalize(List<String> tokens) {
        return tokens.stream()
                .filter(t -> !TextTokenizer.isStopword(t))
                .toList();
    }

    /** One level deep and additive: original tokens stay, expansions are not re-expanded. */
    Set<String> expand(Collection<String> tokens) {
        Set<String> expanded = new LinkedHashSet<>(tokens);
        for (String token : tokens) {
            expanded.addAll(synonyms.expansionsFor(token));
        }
        return expanded;
    }
}
