package es.ulpgc.productsearch.indexing.io;

/**
 * Fatal failure to read an input the run cannot do without: the corpus file, the synonym
 * table or an index snapshot.
 */
public class DataLoadException extends RuntimeException {

    public DataLoadException(String message) {
        super(message);
    }

    public DataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
