package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.index.IndexBuilder;
import es.ulpgc.productsearch.indexing.index.IndexSnapshot;
import es.ulpgc.productsearch.indexing.index.TokenIndex;
import es.ulpgc.productsearch.indexing.model.ProductDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CandidateFilterTest {

    private static final IndexSnapshot SNAPSHOT = new IndexBuilder().build(List.of(
            new ProductDocument("u1", "White Wool Beanie", "Soft knit hat", Map.of("brand", "Nordic"), List.of()),
            new ProductDocument("u2", "White Sneakers", "Leather shoes", Map.of("brand", "Stride"), List.of()),
            new ProductDocument("u3", "Black Beanie", "Warm white lining", Map.of("made in", "Italy"), List.of()),
            new ProductDocument("u4", "Scarf", "Wool scarf", Map.of("brand", "Beanie Co"), List.of())
    ));

    private final CandidateFilter filter = new CandidateFilter(SNAPSHOT);

    @Test
    void filterAnyUnitesPerTokenMatches() {
        assertEquals(Set.of("u1", "u2", "u3"), CandidateFilter.filterAny(List.of("white", "beanie"), SNAPSHOT.title()));
        assertEquals(Set.of("u4"), CandidateFilter.filterAny(List.of("beanie"), SNAPSHOT.feature("brand").orElseThrow()));
    }

    @Test
    void filterAllIntersects() {
        assertEquals(Set.of("u1"), CandidateFilter.filterAll(List.of("white", "beanie"), SNAPSHOT.title()));
    }

    @Test
    void filterAllIsEmptyForEmptyTokensOrAnyUnknownToken() {
        assertEquals(Set.of(), CandidateFilter.filterAll(List.of(), SNAPSHOT.title()));
        assertEquals(Set.of(), CandidateFilter.filterAll(List.of("white", "unicorn"), SNAPSHOT.title()));
    }

    @Test
    void filterAllIsSubsetOfFilterAny() {
        List<List<String>> queries = List.of(
                List.of("white"), List.of("white", "beanie"), List.of("wool", "scarf"), List.of("unicorn"), List.of());
        for (TokenIndex index : SNAPSHOT.candidateIndexes()) {
            for (List<String> tokens : queries) {
                assertTrue(CandidateFilter.filterAny(tokens, index).containsAll(CandidateFilter.filterAll(tokens, index)),
                        index.name() + " " + tokens);
            }
        }
    }

    @Test
    void hybridFilterSearchesEveryIndex() {
        // u3 only via description, u4 only via the brand feature
        assertEquals(Set.of("u1", "u2", "u3"), filter.filter(Set.of("white")));
        assertEquals(Set.of("u1", "u3", "u4"), filter.filter(Set.of("beanie")));
        assertEquals(Set.of("u3"), filter.filter(Set.of("italy")));
    }

    @Test
    void emptyOrUnknownQueryHasNoCandidates() {
        assertEquals(Set.of(), filter.filter(Set.of()));
        assertEquals(Set.of(), filter.filter(Set.of("unicorn")));
    }
}
