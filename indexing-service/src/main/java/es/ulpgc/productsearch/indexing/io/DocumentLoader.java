package es.ulpgc.productsearch.indexing.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import es.ulpgc.productsearch.indexing.model.ProductDocument;
import es.ulpgc.productsearch.indexing.model.ProductReview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a line-delimited JSON corpus into {@link ProductDocument}s.
 *
 * Each line is parsed on its own. Lines that are not JSON objects, that have no usable
 * {@code url}, or that repeat an already loaded URL are skipped and counted; the first
 * record for a URL wins. Optional fields with an unexpected shape are treated as absent.
 */
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    public CorpusLoadResult load(Path corpusFile) {
        if (!Files.isRegularFile(corpusFile)) {
            throw new DataLoadException("Corpus file not found: " + corpusFile);
        }
        try (BufferedReader reader = Files.newBufferedReader(corpusFile, StandardCharsets.UTF_8)) {
            CorpusLoadResult result = load(reader);
            log.info("Loaded {} documents from {} ({} skipped)",
                    result.getDocuments().size(), corpusFile, result.getSkippedRecords());
            return result;
        } catch (IOException e) {
            throw new DataLoadException("Failed to read corpus " + corpusFile + ": " + e.getMessage(), e);
        }
    }

    public CorpusLoadResult load(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        List<ProductDocument> documents = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skipped = 0;
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) continue;

            ProductDocument doc = parseLine(line, lineNumber);
            if (doc == null) {
                skipped++;
            } else if (!seen.add(doc.getUrl())) {
                log.warn("Line {}: duplicate url {}, keeping the first record", lineNumber, doc.getUrl());
                skipped++;
            } else {
                documents.add(doc);
            }
        }
        return new CorpusLoadResult(documents, skipped);
    }

    ProductDocument parseLine(String line, int lineNumber) {
        JsonElement element;
        try {
            element = JsonParser.parseString(line);
        } catch (JsonParseException e) {
            log.warn("Line {}: unparsable JSON, skipping ({})", lineNumber, e.getMessage());
            return null;
        }
        if (!element.isJsonObject()) {
            log.warn("Line {}: not a JSON object, skipping", lineNumber);
            return null;
        }

        JsonObject obj = element.getAsJsonObject();
        String url = string(obj, "url");
        if (url == null || url.isBlank()) {
            log.warn("Line {}: missing url, skipping", lineNumber);
            return null;
        }

        return new ProductDocument(
                url,
                string(obj, "title"),
                string(obj, "description"),
                features(obj),
                reviews(obj)
        );
    }

    private static Map<String, String> features(JsonObject obj) {
        Map<String, String> features = new LinkedHashMap<>();
        JsonElement raw = obj.get("product_features");
        if (raw == null || !raw.isJsonObject()) return features;

        for (Map.Entry<String, JsonElement> e : raw.getAsJsonObject().entrySet()) {
            JsonElement value = e.getValue();
            if (value != null && value.isJsonPrimitive()) {
                features.put(e.getKey(), value.getAsString());
            }
        }
        return features;
    }

    private static List<ProductReview> reviews(JsonObject obj) {
        List<ProductReview> reviews = new ArrayList<>();
        JsonElement raw = obj.get("product_reviews");
        if (raw == null || !raw.isJsonArray()) return reviews;

        JsonArray array = raw.getAsJsonArray();
        for (JsonElement item : array) {
            if (!item.isJsonObject()) continue;
            JsonObject review = item.getAsJsonObject();
            reviews.add(new ProductReview(rating(review), string(review, "date"), string(review, "text")));
        }
        return reviews;
    }

    private static Integer rating(JsonObject review) {
        JsonElement raw = review.get("rating");
        if (raw == null || !raw.isJsonPrimitive()) return null;
        JsonPrimitive p = raw.getAsJsonPrimitive();
        if (!p.isNumber()) return null;
        double value = p.getAsDouble();
        if (value != Math.rint(value) || value < MIN_RATING || value > MAX_RATING) return null;
        return (int) value;
    }

    private static String string(JsonObject obj, String key) {
        JsonElement raw = obj.get(key);
        if (raw == null || raw.isJsonNull() || !raw.isJsonPrimitive()) return null;
        return raw.getAsString();
    }
}
