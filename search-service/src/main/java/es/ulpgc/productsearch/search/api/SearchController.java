package es.ulpgc.productsearch.search.api;

import com.google.gson.Gson;
import es.ulpgc.productsearch.search.core.RankingMode;
import es.ulpgc.productsearch.search.core.SearchEngine;
import es.ulpgc.productsearch.search.model.SearchResponse;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Endpoints HTTP:
 * - GET /health
 * - GET /search?q=...&limit=10&ranking=combined|bm25
 * - GET /terms/{term}
 * - GET /stats
 */
public class SearchController {

    private final Javalin app;
    private final SearchEngine engine;
    private final int defaultLimit;
    private final Gson gson;

    public SearchController(Javalin app, SearchEngine engine, int defaultLimit, Gson gson) {
        this.app = app;
        this.engine = engine;
        this.defaultLimit = defaultLimit;
        this.gson = gson;
    }

    public void registerRoutes() {
        app.get("/health", ctx -> respond(ctx, 200, Map.of("status", "UP")));

        app.get("/search", this::handleSearch);

        app.get("/terms/{term}", ctx -> {
            String term = ctx.pathParam("term");
            respond(ctx, 200, Map.of(
                    "term", term,
                    "docs", engine.docsForTerm(term)
            ));
        });

        app.get("/stats", ctx -> respond(ctx, 200, engine.stats()));
    }

    private void handleSearch(Context ctx) {
        String query = ctx.queryParam("q");
        if (query == null || query.isBlank()) {
            respond(ctx, 400, Map.of("error", "Missing 'q' query parameter"));
            return;
        }

        int limit;
        RankingMode mode;
        try {
            limit = parseLimit(ctx.queryParam("limit"));
            mode = RankingMode.fromParam(ctx.queryParam("ranking"));
        } catch (IllegalArgumentException e) {
            respond(ctx, 400, Map.of("error", e.getMessage()));
            return;
        }

        SearchResponse response = engine.search(query, limit, mode);
        respond(ctx, 200, response);
    }

    int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) return defaultLimit;
        int limit;
        try {
            limit = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number: " + raw, e);
        }
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + raw);
        return limit;
    }

    private void respond(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(gson.toJson(body));
    }
}
