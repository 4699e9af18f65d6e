package es.ulpgc.productsearch.search.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Settings of the search service, read from the environment.
 */
public final class SearchConfig {

    private static final Logger log = LoggerFactory.getLogger(SearchConfig.class);

    static final int DEFAULT_PORT = 8082;
    static final int DEFAULT_LIMIT = 10;

    private final Path corpusFile;
    private final Path indexDir;
    private final Path synonymsFile;
    private final Path resultsFile;
    private final int port;
    private final int defaultLimit;
    private final int scoringThreads;

    public SearchConfig(Path corpusFile, Path indexDir, Path synonymsFile, Path resultsFile,
                        int port, int defaultLimit, int scoringThreads) {
        this.corpusFile = corpusFile;
        this.indexDir = indexDir;
        this.synonymsFile = synonymsFile;
        this.resultsFile = resultsFile;
        this.port = port;
        this.defaultLimit = defaultLimit;
        this.scoringThreads = scoringThreads;
    }

    public static SearchConfig fromEnvironment() {
        return from(System.getenv());
    }

    static SearchConfig from(Map<String, String> env) {
        return new SearchConfig(
                Path.of(env.getOrDefault("CORPUS_FILE", "input/products.jsonl")),
                Path.of(env.getOrDefault("INDEX_DIR", "input")),
                Path.of(env.getOrDefault("SYNONYMS_FILE", "input/origin_synonyms.json")),
                Path.of(env.getOrDefault("SEARCH_RESULTS_FILE", "output/results.json")),
                intValue(env, "SEARCH_SERVICE_PORT", DEFAULT_PORT),
                intValue(env, "SEARCH_DEFAULT_LIMIT", DEFAULT_LIMIT),
                intValue(env, "SEARCH_SCORING_THREADS", 1)
        );
    }

    private static int intValue(Map<String, String> env, String key, int fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}, not a number; using {}", key, raw, fallback);
            return fallback;
        }
    }

    public Path getCorpusFile() {
        return corpusFile;
    }

    public Path getIndexDir() {
        return indexDir;
    }

    public Path getSynonymsFile() {
        return synonymsFile;
    }

    public Path getResultsFile() {
        return resultsFile;
    }

    public int getPort() {
        return port;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public int getScoringThreads() {
        return scoringThreads;
    }
}
