package es.ulpgc.productsearch.indexing.index;

import java.util.Set;

/**
 * Lookup shared by positional and feature indexes: which documents contain a token.
 */
public interface TokenIndex {

    /** Name used in logs, snapshot file names and the stats endpoint. */
    String name();

    /** URLs of the documents containing {@code token}; empty when the token is unknown. */
    Set<String> documentsFor(String token);

    Set<String> vocabulary();
}
