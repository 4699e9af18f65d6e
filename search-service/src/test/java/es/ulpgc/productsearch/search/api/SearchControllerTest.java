package es.ulpgc.productsearch.search.api;

import com.google.gson.Gson;
import es.ulpgc.productsearch.indexing.index.IndexBuilder;
import es.ulpgc.productsearch.search.core.DocumentCatalog;
import es.ulpgc.productsearch.search.core.SearchEngine;
import es.ulpgc.productsearch.search.core.SynonymTable;
import io.javalin.Javalin;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearchControllerTest {

    private final SearchController controller = new SearchController(
            Javalin.create(),
            new SearchEngine(new IndexBuilder().build(List.of()), DocumentCatalog.of(List.of()), SynonymTable.empty()),
            10,
            new Gson());

    @Test
    void limitDefaultsWhenAbsent() {
        assertEquals(10, controller.parseLimit(null));
        assertEquals(10, controller.parseLimit(" "));
        assertEquals(25, controller.parseLimit("25"));
    }

    @Test
    void rejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> controller.parseLimit("ten"));
        assertThrows(IllegalArgumentException.class, () -> controller.parseLimit("0"));
        assertThrows(IllegalArgumentException.class, () -> controller.parseLimit("-3"));
    }
}
