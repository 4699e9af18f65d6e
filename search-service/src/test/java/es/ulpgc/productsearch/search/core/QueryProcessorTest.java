package es.ulpgc.productsearch.search.core;

import es.ulpgc.productsearch.indexing.io.DataLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryProcessorTest {

    @Test
    void tokenizesAndDropsStopwords() {
        QueryProcessor processor = new QueryProcessor(SynonymTable.empty());

        assertEquals(Set.of("white", "beanie"), processor.process("The WHITE beanie!"));
        assertEquals(Set.of(), processor.process("   "));
        assertEquals(Set.of(), processor.process("the and of"));
    }

    @Test
    void collapsesDuplicates() {
        QueryProcessor processor = new QueryProcessor(SynonymTable.empty());

        assertEquals(Set.of("beanie"), processor.process("beanie Beanie BEANIE"));
    }

    @Test
    void expandsWithSynonymsAdditively() {
        SynonymTable synonyms = SynonymTable.of(Map.of("usa", List.of("United States", "America")));
        QueryProcessor processor = new QueryProcessor(synonyms);

        assertEquals(Set.of("beanie", "usa", "united", "states", "america"), processor.process("beanie USA"));
    }

    @Test
    void expansionIsOneLevelAndOneWay() {
        SynonymTable synonyms = SynonymTable.of(Map.of(
                "usa", List.of("america"),
                "america", List.of("yankee")));
        QueryProcessor processor = new QueryProcessor(synonyms);

        assertEquals(Set.of("usa", "america"), processor.process("usa"));
        assertEquals(Set.of("america", "yankee"), processor.process("america"));
        assertEquals(Set.of("yankee"), processor.process("yankee"));
    }

    @Test
    void synonymKeysAreTokenizedLikeQueries() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put(" USA! ", List.of("america"));
        raw.put("United States", List.of("usa"));
        raw.put("U.S.A.", List.of("usa"));
        SynonymTable synonyms = SynonymTable.of(raw);

        assertEquals(1, synonyms.size());
        assertEquals(Set.of("america"), synonyms.expansionsFor("usa"));
        assertEquals(Set.of("united", "states"), new QueryProcessor(synonyms).process("united states"));
    }

    @Test
    void synonymMissLeavesTokenAlone() {
        QueryProcessor processor = new QueryProcessor(SynonymTable.of(Map.of("usa", List.of("america"))));

        assertEquals(Set.of("italy"), processor.process("Italy"));
    }

    @Test
    void normalizeIsIdempotentWithTokenizer() {
        QueryProcessor processor = new QueryProcessor(SynonymTable.empty());
        List<String> tokens = processor.tokenize("A hat for the winter");

        assertEquals(tokens, processor.normalize(tokens));
    }

    @Test
    void loadsSynonymFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("origin_synonyms.json");
        Files.writeString(file, "{\"USA\": [\"United States\", \"America\"]}", StandardCharsets.UTF_8);

        SynonymTable table = SynonymTable.load(file);

        assertEquals(1, table.size());
        assertEquals(Set.of("united", "states", "america"), table.expansionsFor("usa"));
    }

    @Test
    void missingSynonymFileGivesEmptyTable(@TempDir Path dir) {
        assertEquals(0, SynonymTable.load(dir.resolve("none.json")).size());
    }

    @Test
    void malformedSynonymFileIsFatal(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("origin_synonyms.json");
        Files.writeString(file, "{\"usa\": \"america\"", StandardCharsets.UTF_8);

        assertThrows(DataLoadException.class, () -> SynonymTable.load(file));
    }
}
