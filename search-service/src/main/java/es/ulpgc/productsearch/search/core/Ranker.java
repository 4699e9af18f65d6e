package es.ulpgc.productsearch.search.core;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scored candidates by score descending, then URL ascending, so the output is the
 * same on every run regardless of candidate-set iteration order.
 */
public class Ranker {

    public List<ScoredDocument> rank(Collection<ScoredDocument> scored, RankingMode mode) {
        Comparator<ScoredDocument> byScore =
                Comparator.comparingDouble((ScoredDocument d) -> d.scoreFor(mode)).reversed();
        return scored.stream()
                .sorted(byScore.thenComparing(ScoredDocument::url))
                .toList();
    }

    public List<ScoredDocument> rank(Collection<ScoredDocument> scored) {
        return rank(scored, RankingMode.COMBINED);
    }
}
