package es.ulpgc.productsearch.search.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * JSON payload of a query: the query, corpus size, candidate count and ranked hits.
 */
public class SearchResponse {

    private final String query;

    @SerializedName("total_documents")
    private final int totalDocuments;

    @SerializedName("filtered_documents")
    private final int filteredDocuments;

    private final List<SearchHit> results;

    public SearchResponse(String query, int totalDocuments, int filteredDocuments, List<SearchHit> results) {
        this.query = query;
        this.totalDocuments = totalDocuments;
        this.filteredDocuments = filteredDocuments;
        this.results = List.copyOf(results);
    }

    public String getQuery() {
        return query;
    }

    public int getTotalDocuments() {
        return totalDocuments;
    }

    public int getFilteredDocuments() {
        return filteredDocuments;
    }

    public List<SearchHit> getResults() {
        return results;
    }
}
