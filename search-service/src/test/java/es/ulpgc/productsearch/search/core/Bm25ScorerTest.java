package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.index.PositionalIndex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Bm25ScorerTest {

    private final Bm25Scorer bm25 = new Bm25Scorer();

    private static PositionalIndex titles() {
        return PositionalIndex.builder("title")
                .add("d1", List.of("white", "beanie"))
                .add("d2", List.of("black", "boots"))
                .build();
    }

    @Test
    void usesDocumentedDefaults() {
        assertEquals(1.5, Bm25Scorer.DEFAULT_K1);
        assertEquals(0.75, Bm25Scorer.DEFAULT_B);
    }

    @Test
    void matchesHandComputedScore() {
        // N=2, df=1, tf=1, |d|=avgdl=2: idf = ln(1.5/1.5 + 1) = ln 2, tf part = 2.5 / 2.5
        assertEquals(Math.log(2), bm25.score("d1", List.of("white"), titles(), 2), 1e-12);
        assertEquals(2 * Math.log(2), bm25.score("d1", List.of("white", "beanie"), titles(), 2), 1e-12);
    }

    @Test
    void documentWithoutQueryTokensScoresZero() {
        assertEquals(0.0, bm25.score("d2", List.of("white", "beanie"), titles(), 2));
        assertEquals(0.0, bm25.termScore(0, 1, 10, 5.0, 2));
    }

    @Test
    void termScoreGrowsWithTermFrequency() {
        double previous = 0.0;
        for (int tf = 1; tf <= 20; tf++) {
            double s = bm25.termScore(tf, 3, 20, 15.0, 10);
            assertTrue(s > previous, "tf=" + tf);
            previous = s;
        }
        // saturates below idf * (k1 + 1)
        assertTrue(previous < bm25.idf(3, 10) * (Bm25Scorer.DEFAULT_K1 + 1));
    }

    @Test
    void idfStaysPositiveWhenTokenIsEverywhere() {
        double everywhere = bm25.idf(10, 10);
        assertTrue(everywhere > 0);
        assertTrue(everywhere < bm25.idf(1, 10));
        assertEquals(Math.log(0.5 / 10.5 + 1), everywhere, 1e-12);
    }

    @Test
    void scoreSumsOverQueryTokens() {
        double white = bm25.score("d2", List.of("white"), titles(), 2);
        double boots = bm25.score("d2", List.of("boots"), titles(), 2);

        assertEquals(Math.log(2), bm25.score("d1", List.of("white", "boots"), titles(), 2), 1e-12);
        assertEquals(white + boots, bm25.score("d2", List.of("white", "boots"), titles(), 2), 1e-12);
    }

    @Test
    void emptyCorpusYieldsNoScores() {
        PositionalIndex empty = PositionalIndex.empty("title");

        assertEquals(0.0, bm25.score("d1", List.of("white"), empty, 0));
    }
}
