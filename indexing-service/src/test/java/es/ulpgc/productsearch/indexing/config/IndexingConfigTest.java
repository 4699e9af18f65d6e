package es.ulpgc.productsearch.indexing.config;

import es.ulpgc.productsearch.indexing.index.TextField;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IndexingConfigTest {

    @Test
    void defaults() {
        IndexingConfig config = IndexingConfig.from(Map.of());

        assertEquals(Path.of("input/products.jsonl"), config.getCorpusFile());
        assertEquals(Path.of("output"), config.getOutputDir());
        assertEquals(EnumSet.allOf(TextField.class), config.getFields());
        assertTrue(config.getFeatureKeys().isEmpty());
    }

    @Test
    void parsesFieldAndFeatureLists() {
        IndexingConfig config = IndexingConfig.from(Map.of(
                "INDEX_FIELDS", " Title ",
                "INDEX_FEATURES", "brand, made in,,"));

        assertEquals(EnumSet.of(TextField.TITLE), config.getFields());
        assertEquals(List.of("brand", "made in"), config.getFeatureKeys());
    }

    @Test
    void unknownFieldIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> IndexingConfig.from(Map.of("INDEX_FIELDS", "title,price")));
    }
}
