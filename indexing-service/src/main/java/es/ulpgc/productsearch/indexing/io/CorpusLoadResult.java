package es.ulpgc.productsearch.indexing.io;

import es.ulpgc.productsearch.indexing.model.ProductDocument;

import java.util.List;

/**
 * Documents parsed from a corpus file plus the number of records that were skipped.
 */
public final class CorpusLoadResult {

    private final List<ProductDocument> documents;
    private final int skippedRecords;

    public CorpusLoadResult(List<ProductDocument> documents, int skippedRecords) {
        this.documents = List.copyOf(documents);
        this.skippedRecords = skippedRecords;
    }

    public List<ProductDocument> getDocuments() {
        return documents;
    }

    public int getSkippedRecords() {
        return skippedRecords;
    }
}
