package es.ulpgc.productsearch.search.core;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import es.ulpgc.productsearch.indexing.io.DataLoadException;
import es.ulpgc.productsearch.indexing.util.TextTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One-way synonym table: a canonical token maps to the tokens it expands to.
 *
 * Keys and values go through the shared tokenizer, the same one queries use. A key must
 * reduce to exactly one token ("USA!" becomes "usa"); keys such as "United States" or "U.S.A."
 * can never equal a single query token and are ignored with a warning. A multi-word value such
 * as "United States" expands to the tokens "united" and "states", which are what the indexes
 * contain.
 */
public final class SynonymTable {

    private static final Logger log = LoggerFactory.getLogger(SynonymTable.class);
    private static final Type RAW = new TypeToken<Map<String, List<String>>>() {}.getType();

    private final Map<String, Set<String>> entries;

    private SynonymTable(Map<String, Set<String>> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static SynonymTable empty() {
        return new SynonymTable(Map.of());
    }

    public static SynonymTable of(Map<String, ? extends Collection<String>> raw) {
        Map<String, Set<String>> entries = new LinkedHashMap<>();
        raw.forEach((key, values) -> {
            if (key == null || key.isBlank() || values == null) return;
            List<String> keyTokens = TextTokenizer.tokens(key);
            if (keyTokens.size() != 1) {
                log.warn("Synonym key '{}' is not a single query token {}, ignored", key, keyTokens);
                return;
            }
            Set<String> expansions = entries.computeIfAbsent(keyTokens.get(0), k -> new LinkedHashSet<>());
            for (String value : values) {
                expansions.addAll(TextTokenizer.tokens(value));
            }
        });
        entries.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        return new SynonymTable(entries);
    }

    /**
     * Reads a {@code {"token": ["synonym", ...]}} file. A missing file yields an empty
     * table; an unreadable or malformed one is fatal.
     */
    public static SynonymTable load(Path file) {
        if (!Files.exists(file)) {
            log.warn("Synonym file {} not found, queries will not be expanded", file);
            return empty();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, List<String>> raw = new Gson().fromJson(reader, RAW);
            if (raw == null) {
                throw new DataLoadException("Synonym file is empty: " + file);
            }
            SynonymTable table = of(raw);
            log.info("Loaded {} synonym entries from {}", table.size(), file);
            return table;
        } catch (IOException | JsonParseException e) {
            throw new DataLoadException("Failed to read synonym file " + file + ": " + e.getMessage(), e);
        }
    }

    public Set<String> expansionsFor(String token) {
        return entries.getOrDefault(token, Set.of());
    }

    public int size() {
        return entries.size();
    }
}
