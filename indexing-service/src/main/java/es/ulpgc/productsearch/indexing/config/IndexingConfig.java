package es.ulpgc.productsearch.indexing.config;

import es.ulpgc.productsearch.indexing.index.TextField;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings of the indexing batch, read from the environment.
 */
public final class IndexingConfig {

    private final Path corpusFile;
    private final Path outputDir;
    private final Set<TextField> fields;
    private final List<String> featureKeys;

    public IndexingConfig(Path corpusFile, Path outputDir, Set<TextField> fields, List<String> featureKeys) {
        this.corpusFile = corpusFile;
        this.outputDir = outputDir;
        this.fields = fields.isEmpty() ? EnumSet.noneOf(TextField.class) : EnumSet.copyOf(fields);
        this.featureKeys = List.copyOf(featureKeys);
    }

    public static IndexingConfig fromEnvironment() {
        return from(System.getenv());
    }

    static IndexingConfig from(Map<String, String> env) {
        Path corpus = Path.of(env.getOrDefault("CORPUS_FILE", "input/products.jsonl"));
        Path output = Path.of(env.getOrDefault("INDEX_OUTPUT_DIR", "output"));

        Set<TextField> fields = EnumSet.noneOf(TextField.class);
        for (String key : splitList(env.getOrDefault("INDEX_FIELDS", "title,description"))) {
            fields.add(TextField.fromKey(key));
        }
        List<String> features = splitList(env.getOrDefault("INDEX_FEATURES", ""));
        return new IndexingConfig(corpus, output, fields, features);
    }

    private static List<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public Path getCorpusFile() {
        return corpusFile;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Set<TextField> getFields() {
        return fields;
    }

    /** Empty means every feature key found in the corpus. */
    public List<String> getFeatureKeys() {
        return featureKeys;
    }
}
