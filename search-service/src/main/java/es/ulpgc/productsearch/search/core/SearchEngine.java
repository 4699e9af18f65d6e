package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.index.FeatureIndex;
import es.ulpgc.productsearch.indexing.index.IndexSnapshot;
import es.ulpgc.productsearch.indexing.index.TokenIndex;
import es.ulpgc.productsearch.search.model.SearchHit;
import es.ulpgc.productsearch.search.model.SearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a query end to end: process, filter, score, rank.
 *
 * The snapshot and catalog are read-only, so one engine serves concurrent queries. With
 * more than one scoring thread, candidates are split into disjoint slices scored in
 * parallel; the ranking is the same either way.
 */
public class SearchEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

    private final IndexSnapshot snapshot;
    private final DocumentCatalog catalog;
    private final QueryProcessor queryProcessor;
    private final CandidateFilter candidateFilter;
    private final RelevanceScorer scorer;
    private final Ranker ranker = new Ranker();
    private final int scoringThreads;
    private final ExecutorService scoringPool;

    public SearchEngine(IndexSnapshot snapshot, DocumentCatalog catalog, SynonymTable synonyms) {
        this(snapshot, catalog, synonyms, ScoringWeights.DEFAULT, 1);
    }

    public SearchEngine(IndexSnapshot snapshot, DocumentCatalog catalog, SynonymTable synonyms,
                        ScoringWeights weights, int scoringThreads) {
        this.snapshot = snapshot;
        this.catalog = catalog;
        this.queryProcessor = new QueryProcessor(synonyms);
        this.candidateFilter = new CandidateFilter(snapshot);
        this.scorer = new RelevanceScorer(snapshot, weights, new Bm25Scorer());
        this.scoringThreads = Math.max(1, scoringThreads);
        this.scoringPool = this.scoringThreads > 1 ? Executors.newFixedThreadPool(this.scoringThreads) : null;
    }

    public SearchResponse search(String query) {
        return search(query, Integer.MAX_VALUE, RankingMode.COMBINED);
    }

    /**
     * @param limit maximum number of hits returned; the candidate count is reported in full
     */
    public SearchResponse search(String query, int limit, RankingMode mode) {
        Set<String> tokens = queryProcessor.process(query);
        Set<String> candidates = candidateFilter.filter(tokens);

        // No documents means avgdl is undefined: answer with nothing rather than divide by zero.
        if (snapshot.documentCount() == 0 || candidates.isEmpty()) {
            log.info("Query '{}' -> tokens {} matched no documents", query, tokens);
            return new SearchResponse(query, catalog.size(), candidates.size(), List.of());
        }

        List<ScoredDocument> ranked = ranker.rank(score(candidates, tokens), mode);
        List<SearchHit> hits = ranked.stream()
                .limit(Math.max(0, limit))
                .map(this::toHit)
                .toList();

        log.info("Query '{}' -> tokens {}, {} candidates, {} returned", query, tokens, candidates.size(), hits.size());
        return new SearchResponse(query, catalog.size(), candidates.size(), hits);
    }

    List<ScoredDocument> score(Collection<String> candidates, Set<String> tokens) {
        List<String> urls = new ArrayList<>(candidates);
        if (scoringPool == null || urls.size() < scoringThreads * 2) {
            return scoreSlice(urls, tokens);
        }

        int sliceSize = (urls.size() + scoringThreads - 1) / scoringThreads;
        List<Future<List<ScoredDocument>>> futures = new ArrayList<>();
        for (int from = 0; from < urls.size(); from += sliceSize) {
            List<String> slice = urls.subList(from, Math.min(urls.size(), from + sliceSize));
            futures.add(scoringPool.submit(() -> scoreSlice(slice, tokens)));
        }

        List<ScoredDocument> scored = new ArrayList<>(urls.size());
        try {
            for (Future<List<ScoredDocument>> f : futures) {
                scored.addAll(f.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Scoring interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scoring failed: " + e.getCause().getMessage(), e.getCause());
        }
        return scored;
    }

    private List<ScoredDocument> scoreSlice(List<String> urls, Set<String> tokens) {
        List<ScoredDocument> scored = new ArrayList<>(urls.size());
        for (String url : urls) {
            scored.add(new ScoredDocument(url, scorer.computeScore(url, tokens), scorer.bm25(url, tokens)));
        }
        return scored;
    }

    private SearchHit toHit(ScoredDocument doc) {
        DocumentCatalog.Entry entry = catalog.get(doc.url()).orElse(null);
        if (entry == null) {
            log.warn("No catalog entry for {}, returning it without title", doc.url());
        }
        return new SearchHit(
                entry == null ? "" : entry.getTitle(),
                doc.url(),
                entry == null ? "" : entry.getDescription(),
                round(doc.score()),
                round(doc.bm25())
        );
    }

    static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    /** URLs holding {@code term} in each index, after the term is normalized like a query. */
    public Map<String, Collection<String>> docsForTerm(String term) {
        Map<String, Collection<String>> result = new LinkedHashMap<>();
        for (String token : queryProcessor.process(term)) {
            for (TokenIndex index : snapshot.candidateIndexes()) {
                Set<String> docs = index.documentsFor(token);
                if (!docs.isEmpty()) {
                    result.computeIfAbsent(index.name(), k -> new ArrayList<>()).addAll(docs);
                }
            }
        }
        return result;
    }

    public Map<String, Object> stats() {
        Map<String, Integer> vocabulary = new LinkedHashMap<>();
        vocabulary.put(snapshot.title().name(), snapshot.title().vocabulary().size());
        vocabulary.put(snapshot.description().name(), snapshot.description().vocabulary().size());
        vocabulary.put(snapshot.reviewText().name(), snapshot.reviewText().vocabulary().size());
        for (FeatureIndex feature : snapshot.features().values()) {
            vocabulary.put(feature.name(), feature.vocabulary().size());
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("documents", snapshot.documentCount());
        stats.put("catalog", catalog.size());
        stats.put("features", new ArrayList<>(snapshot.features().keySet()));
        stats.put("vocabulary", vocabulary);
        return stats;
    }

    @Override
    public void close() {
        if (scoringPool != null) {
            scoringPool.shutdownNow();
        }
    }
}
