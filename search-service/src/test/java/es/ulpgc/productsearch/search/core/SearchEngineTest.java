package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.index.IndexBuilder;
import es.ulpgc.productsearch.indexing.index.IndexSnapshot;
import es.ulpgc.productsearch.indexing.model.ProductDocument;
import es.ulpgc.productsearch.indexing.model.ProductReview;
import es.ulpgc.productsearch.search.model.SearchHit;
import es.ulpgc.productsearch.search.model.SearchResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchEngineTest {

    private static final List<ProductDocument> CORPUS = List.of(
            new ProductDocument("https://shop/beanie", "White Wool Beanie", "A soft white hat.",
                    Map.of("brand", "Nordic", "made in", "United States"),
                    List.of(new ProductReview(5, "2024-01-01", "Great"), new ProductReview(4, "2024-01-02", "Good"))),
            new ProductDocument("https://shop/sneakers", "White Sneakers", "Leather shoes.",
                    Map.of("brand", "Stride", "made in", "Italy"), List.of()),
            new ProductDocument("https://shop/boots", "Black Boots", "Winter boots, waterproof.",
                    Map.of("brand", "Nordic", "made in", "Canada"), List.of())
    );

    private final IndexSnapshot snapshot = new IndexBuilder().build(CORPUS);
    private final SynonymTable synonyms = SynonymTable.of(Map.of("usa", List.of("United States", "America")));
    private final SearchEngine engine = new SearchEngine(snapshot, DocumentCatalog.of(CORPUS), synonyms);

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static List<String> urls(SearchResponse response) {
        return response.getResults().stream().map(SearchHit::getUrl).toList();
    }

    @Test
    void tokenInOneDocumentReturnsExactlyThatDocument() {
        SearchResponse response = engine.search("waterproof");

        assertEquals(List.of("https://shop/boots"), urls(response));
        assertEquals(1, response.getFilteredDocuments());
        assertEquals(3, response.getTotalDocuments());
        assertEquals("Black Boots", response.getResults().get(0).getTitle());
        assertEquals("Winter boots, waterproof.", response.getResults().get(0).getDescription());
    }

    @Test
    void ranksFullTitleMatchFirst() {
        SearchResponse response = engine.search("white beanie");

        assertEquals(List.of("https://shop/beanie", "https://shop/sneakers"), urls(response));
        // 3*2 + 1*1 + 5 + 0.1*2
        assertEquals(12.2, response.getResults().get(0).getScore(), 1e-9);
        assertEquals(3.0, response.getResults().get(1).getScore(), 1e-9);
    }

    @Test
    void resultsAreSortedByScoreDescending() {
        List<SearchHit> hits = engine.search("white nordic boots").getResults();

        for (int i = 1; i < hits.size(); i++) {
            assertTrue(hits.get(i - 1).getScore() >= hits.get(i).getScore());
        }
    }

    @Test
    void synonymsReachFeatureIndexes() {
        SearchResponse response = engine.search("usa");

        assertEquals(List.of("https://shop/beanie"), urls(response));
    }

    @Test
    void emptyOrUnknownQueryReturnsNothing() {
        SearchResponse empty = engine.search("the of and");
        assertEquals(0, empty.getFilteredDocuments());
        assertTrue(empty.getResults().isEmpty());

        SearchResponse unknown = engine.search("unicorn");
        assertEquals(0, unknown.getFilteredDocuments());
        assertEquals(3, unknown.getTotalDocuments());
    }

    @Test
    void limitTruncatesResultsButReportsAllCandidates() {
        SearchResponse response = engine.search("white nordic", 1, RankingMode.COMBINED);

        assertEquals(1, response.getResults().size());
        assertEquals(3, response.getFilteredDocuments());
    }

    @Test
    void emptyCorpusAnswersWithEmptyResults() {
        try (SearchEngine empty = new SearchEngine(new IndexBuilder().build(List.of()),
                DocumentCatalog.of(List.of()), SynonymTable.empty())) {
            SearchResponse response = empty.search("white");
            assertEquals(0, response.getTotalDocuments());
            assertTrue(response.getResults().isEmpty());
        }
    }

    @Test
    void parallelScoringRanksLikeSequential() {
        List<ProductDocument> many = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String title = i % 3 == 0 ? "White Beanie " + i : "White Scarf " + i;
            many.add(new ProductDocument("https://shop/p" + i, title, "white ".repeat(i % 5),
                    Map.of(), List.of()));
        }
        IndexSnapshot big = new IndexBuilder().build(many);
        DocumentCatalog catalog = DocumentCatalog.of(many);

        try (SearchEngine sequential = new SearchEngine(big, catalog, SynonymTable.empty(), ScoringWeights.DEFAULT, 1);
             SearchEngine parallel = new SearchEngine(big, catalog, SynonymTable.empty(), ScoringWeights.DEFAULT, 4)) {
            SearchResponse a = sequential.search("white beanie");
            SearchResponse b = parallel.search("white beanie");

            assertEquals(40, a.getFilteredDocuments());
            assertEquals(urls(a), urls(b));
        }
    }

    @Test
    void bm25RankingIsAvailable() {
        SearchResponse response = engine.search("white beanie", 10, RankingMode.BM25);

        assertEquals("https://shop/beanie", urls(response).get(0));
        assertTrue(response.getResults().get(0).getBm25() > response.getResults().get(1).getBm25());
    }

    @Test
    void docsForTermListsMatchesPerIndex() {
        Map<String, Collection<String>> docs = engine.docsForTerm("Nordic");

        assertEquals(List.of("https://shop/beanie", "https://shop/boots"), List.copyOf(docs.get("brand")));
        assertFalse(docs.containsKey("title"));
    }

    @Test
    void roundsToThreeDecimals() {
        assertEquals(1.235, SearchEngine.round(1.23456), 1e-12);
        assertEquals(2.0, SearchEngine.round(1.99996), 1e-12);
    }
}
