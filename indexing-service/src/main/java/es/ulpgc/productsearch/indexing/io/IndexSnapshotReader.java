package es.ulpgc.productsearch.indexing.io;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import es.ulpgc.productsearch.indexing.index.FeatureIndex;
import es.ulpgc.productsearch.indexing.index.IndexSnapshot;
import es.ulpgc.productsearch.indexing.index.PositionalIndex;
import es.ulpgc.productsearch.indexing.index.TextField;
import es.ulpgc.productsearch.indexing.model.ReviewStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static es.ulpgc.productsearch.indexing.io.IndexSnapshotWriter.RESERVED;
import static es.ulpgc.productsearch.indexing.io.IndexSnapshotWriter.REVIEW_STATS_FILE;
import static es.ulpgc.productsearch.indexing.io.IndexSnapshotWriter.REVIEW_TEXT_FILE;
import static es.ulpgc.productsearch.indexing.io.IndexSnapshotWriter.SUFFIX;

/**
 * Loads the files written by {@link IndexSnapshotWriter} back into an {@link IndexSnapshot}.
 *
 * Title, description and review statistics are required; the review-text index is
 * optional. Every other {@code *_index.json} file in the directory is a feature index named
 * after its file stem.
 */
public class IndexSnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(IndexSnapshotReader.class);

    private static final Type POSITIONAL = new TypeToken<Map<String, Map<String, List<Integer>>>>() {}.getType();
    private static final Type FEATURE = new TypeToken<Map<String, List<String>>>() {}.getType();
    private static final Type REVIEW_STATS = new TypeToken<Map<String, ReviewStats>>() {}.getType();

    private final Gson gson = new Gson();

    public static boolean exists(Path dir) {
        return Files.isRegularFile(dir.resolve(TextField.TITLE.key() + SUFFIX));
    }

    public IndexSnapshot read(Path dir) {
        Map<TextField, PositionalIndex> fields = new EnumMap<>(TextField.class);
        for (TextField field : TextField.values()) {
            Map<String, Map<String, List<Integer>>> raw = readJson(dir.resolve(field.key() + SUFFIX), POSITIONAL);
            fields.put(field, positional(field.key(), raw));
        }

        PositionalIndex reviewText = null;
        Path reviewTextFile = dir.resolve(REVIEW_TEXT_FILE);
        if (Files.isRegularFile(reviewTextFile)) {
            reviewText = positional(IndexSnapshot.REVIEW_TEXT, readJson(reviewTextFile, POSITIONAL));
        }

        Map<String, ReviewStats> reviewStats = readJson(dir.resolve(REVIEW_STATS_FILE), REVIEW_STATS);
        reviewStats.forEach((url, stats) -> {
            if (url == null || stats == null) {
                throw new DataLoadException("Invalid review statistics: null entry for " + url);
            }
            if (stats.getTotalReviews() < 0) {
                throw new DataLoadException("Invalid review statistics for " + url + ": negative total_reviews");
            }
        });

        IndexSnapshot snapshot = new IndexSnapshot(fields, reviewText, readFeatures(dir), reviewStats);
        log.info("Loaded index snapshot from {}: {} documents, features={}",
                dir, snapshot.documentCount(), snapshot.features().keySet());
        return snapshot;
    }

    private Map<String, FeatureIndex> readFeatures(Path dir) {
        Map<String, FeatureIndex> features = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - SUFFIX.length());
                if (RESERVED.contains(name)) continue;
                Map<String, List<String>> raw = readJson(file, FEATURE);
                try {
                    features.put(name, FeatureIndex.fromPostings(name, raw));
                } catch (IllegalArgumentException e) {
                    throw new DataLoadException("Invalid " + name + " index: " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new DataLoadException("Failed to list index directory " + dir + ": " + e.getMessage(), e);
        }
        return new LinkedHashMap<>(features);
    }

    private static PositionalIndex positional(String name, Map<String, Map<String, List<Integer>>> raw) {
        try {
            return PositionalIndex.fromPostings(name, raw);
        } catch (IllegalArgumentException e) {
            throw new DataLoadException("Invalid " + name + " index: " + e.getMessage(), e);
        }
    }

    private <T> T readJson(Path file, Type type) {
        if (!Files.isRegularFile(file)) {
            throw new DataLoadException("Index file not found: " + file);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            T value = gson.fromJson(reader, type);
            if (value == null) {
                throw new DataLoadException("Index file is empty: " + file);
            }
            return value;
        } catch (IOException | JsonParseException e) {
            throw new DataLoadException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
