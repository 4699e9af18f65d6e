package es.ulpgc.productsearch.indexing;

import es.ulpgc.productsearch.indexing.config.IndexingConfig;
import es.ulpgc.productsearch.indexing.index.IndexBuilder;
import es.ulpgc.productsearch.indexing.index.IndexSnapshot;
import es.ulpgc.productsearch.indexing.io.CorpusLoadResult;
import es.ulpgc.productsearch.indexing.io.DocumentLoader;
import es.ulpgc.productsearch.indexing.io.IndexSnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the indexing batch:
 * - Loads the JSONL product corpus.
 * - Builds the title/description/review-text positional indexes, the feature indexes
 *   and the review statistics.
 * - Writes them as JSON snapshots for the search service.
 */
public class IndexingApplication {

    private static final Logger log = LoggerFactory.getLogger(IndexingApplication.class);

    public static void main(String[] args) {
        IndexingConfig config = IndexingConfig.fromEnvironment();
        log.info("Indexing corpus {} into {}", config.getCorpusFile(), config.getOutputDir());

        CorpusLoadResult corpus = new DocumentLoader().load(config.getCorpusFile());
        IndexSnapshot snapshot = new IndexBuilder()
                .build(corpus.getDocuments(), config.getFields(), config.getFeatureKeys());
        new IndexSnapshotWriter().write(snapshot, config.getOutputDir());

        log.info("Indexing finished: {} documents indexed, {} records skipped",
                snapshot.documentCount(), corpus.getSkippedRecords());
    }
}
