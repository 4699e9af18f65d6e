package es.ulpgc.productsearch.search.model;

/**
 * A single product returned by a search, with its combined score and the BM25 diagnostic.
 */
public class SearchHit {

    private final String title;
    private final String url;
    private final String description;
    private final double score;
    private final double bm25;

    public SearchHit(String title, String url, String description, double score, double bm25) {
        this.title = title;
        this.url = url;
        this.description = description;
        this.score = score;
        this.bm25 = bm25;
    }

    public String getTitle() {
        return title;
    }

    public String getUrl() {
        return url;
    }

    public String getDescription() {
        return description;
    }

    public double getScore() {
        return score;
    }

    public double getBm25() {
        return bm25;
    }
}
