package es.ulpgc.productsearch.search;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import es.ulpgc.productsearch.indexing.index.IndexBuilder;
import es.ulpgc.productsearch.indexing.index.IndexSnapshot;
import es.ulpgc.productsearch.indexing.io.CorpusLoadResult;
import es.ulpgc.productsearch.indexing.io.DocumentLoader;
import es.ulpgc.productsearch.indexing.io.IndexSnapshotReader;
import es.ulpgc.productsearch.search.api.SearchController;
import es.ulpgc.productsearch.search.config.SearchConfig;
import es.ulpgc.productsearch.search.core.DocumentCatalog;
import es.ulpgc.productsearch.search.core.ScoringWeights;
import es.ulpgc.productsearch.search.core.SearchEngine;
import es.ulpgc.productsearch.search.core.SynonymTable;
import es.ulpgc.productsearch.search.model.SearchResponse;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Main class for the search service.
 *
 * Loads the corpus, the index snapshot (or builds it in memory when the index directory
 * holds none) and the synonym table. With arguments, runs them as one query and writes the
 * result JSON to the results file. Without arguments, starts the HTTP server.
 */
public class SearchApplication {

    private static final Logger log = LoggerFactory.getLogger(SearchApplication.class);

    private static final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public static void main(String[] args) {
        SearchConfig config = SearchConfig.fromEnvironment();
        SearchEngine engine = createEngine(config);

        if (args.length > 0) {
            String query = String.join(" ", args);
            try (engine) {
                writeResults(engine.search(query), config.getResultsFile());
            }
            return;
        }

        Javalin app = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        new SearchController(app, engine, config.getDefaultLimit(), gson).registerRoutes();

        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled exception", e);
            ctx.status(500).contentType("application/json")
                    .result(gson.toJson(Map.of("error", "internal server error")));
        });

        app.events(events -> events.serverStopped(engine::close));

        app.start(config.getPort());
        log.info("search-service started on port {}", config.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(app::stop));
    }

    static SearchEngine createEngine(SearchConfig config) {
        CorpusLoadResult corpus = new DocumentLoader().load(config.getCorpusFile());

        IndexSnapshot snapshot;
        if (IndexSnapshotReader.exists(config.getIndexDir())) {
            snapshot = new IndexSnapshotReader().read(config.getIndexDir());
        } else {
            log.info("No index snapshot in {}, building indexes in memory", config.getIndexDir());
            snapshot = new IndexBuilder().build(corpus.getDocuments());
        }

        SynonymTable synonyms = SynonymTable.load(config.getSynonymsFile());
        return new SearchEngine(snapshot, DocumentCatalog.of(corpus.getDocuments()), synonyms,
                ScoringWeights.DEFAULT, config.getScoringThreads());
    }

    static void writeResults(SearchResponse response, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, gson.toJson(response), StandardCharsets.UTF_8);
            log.info("Wrote {} results for '{}' to {}", response.getResults().size(), response.getQuery(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results to " + file, e);
        }
    }
}
