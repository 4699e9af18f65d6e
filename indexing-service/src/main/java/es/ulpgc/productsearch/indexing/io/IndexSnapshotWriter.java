package es.ulpgc.productsearch.indexing.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import es.ulpgc.productsearch.indexing.index.FeatureIndex;
import es.ulpgc.productsearch.indexing.index.IndexSnapshot;
import es.ulpgc.productsearch.indexing.index.TextField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes an {@link IndexSnapshot} as flat JSON files, one per structure.
 *
 * <ul>
 *   <li>{@code title_index.json}, {@code description_index.json}, {@code review_text_index.json}:
 *       {@code {token: {url: [positions]}}}</li>
 *   <li>{@code <feature>_index.json}: {@code {token: [urls]}}</li>
 *   <li>{@code reviews_index.json}: {@code {url: {total_reviews, mean_mark, last_rating}}}</li>
 * </ul>
 */
public class IndexSnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(IndexSnapshotWriter.class);

    static final String SUFFIX = "_index.json";
    static final String REVIEW_STATS_FILE = "reviews" + SUFFIX;
    static final String REVIEW_TEXT_FILE = IndexSnapshot.REVIEW_TEXT + SUFFIX;
    static final Set<String> RESERVED = Set.of(
            TextField.TITLE.key(), TextField.DESCRIPTION.key(), "reviews", IndexSnapshot.REVIEW_TEXT);

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    public List<Path> write(IndexSnapshot snapshot, Path outputDir) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);

            for (TextField field : TextField.values()) {
                written.add(writeJson(outputDir.resolve(field.key() + SUFFIX), snapshot.field(field).asMap()));
            }
            written.add(writeJson(outputDir.resolve(REVIEW_TEXT_FILE), snapshot.reviewText().asMap()));
            written.add(writeJson(outputDir.resolve(REVIEW_STATS_FILE), snapshot.reviewStats()));

            for (Map.Entry<String, Map<String, Set<String>>> e : featuresByFile(snapshot).entrySet()) {
                written.add(writeJson(outputDir.resolve(e.getKey() + SUFFIX), e.getValue()));
            }
        } catch (IOException | JsonIOException e) {
            throw new IllegalStateException("Failed to write index snapshot to " + outputDir + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} index files to {}", written.size(), outputDir);
        return written;
    }

    /**
     * Groups feature postings by file stem. Keys sharing a stem ("made in" and "origin",
     * "Brand" and "brand") are merged into one file so that no posting is lost on disk.
     */
    static Map<String, Map<String, Set<String>>> featuresByFile(IndexSnapshot snapshot) {
        Map<String, Map<String, Set<String>>> byFile = new LinkedHashMap<>();
        Map<String, String> owners = new LinkedHashMap<>();
        for (Map.Entry<String, FeatureIndex> e : snapshot.features().entrySet()) {
            String name = featureFileName(e.getKey());
            if (RESERVED.contains(name)) {
                log.warn("Feature '{}' collides with a reserved index name, not written", e.getKey());
                continue;
            }
            String owner = owners.putIfAbsent(name, e.getKey());
            if (owner != null) {
                log.warn("Features '{}' and '{}' share the file {}{}, postings merged",
                        owner, e.getKey(), name, SUFFIX);
            }
            Map<String, Set<String>> merged = byFile.computeIfAbsent(name, k -> new LinkedHashMap<>());
            e.getValue().asMap().forEach((token, urls) ->
                    merged.computeIfAbsent(token, k -> new LinkedHashSet<>()).addAll(urls));
        }
        return byFile;
    }

    /** File stem for a feature key; "made in" is stored as "origin". */
    public static String featureFileName(String featureKey) {
        String normalized = featureKey.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("made in")) return "origin";
        return normalized.replaceAll("[^\\p{L}\\p{Nd}]+", "_");
    }

    private Path writeJson(Path file, Object payload) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(payload, writer);
        }
        return file;
    }
}
