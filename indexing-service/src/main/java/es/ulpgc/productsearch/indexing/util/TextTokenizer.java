package es.ulpgc.productsearch.indexing.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tokenizer shared by indexing and querying.
 *
 * Lowercases, treats every character that is not a letter or digit as a separator
 * (so "don't" yields "don" and "t"), and drops stopwords. Token order is preserved
 * because positional indexes depend on it.
 */
public final class TextTokenizer {

    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{Nd}]+");

    public static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "if", "while", "with", "of", "at", "by", "for",
            "in", "on", "to", "from", "as", "is", "are", "was", "were", "be", "been", "has", "have",
            "it", "this", "that", "these", "those", "so", "not", "your", "my", "their", "our",
            "can", "will", "just", "i", "you", "he", "she", "they", "we", "me", "him", "her",
            "them", "do", "does", "did"
    );

    private TextTokenizer() {}

    public static List<String> tokens(String text) {
        if (text == null || text.isBlank()) return List.of();
        return Arrays.stream(SPLIT.split(text.toLowerCase(Locale.ROOT)))
                .filter(t -> !t.isBlank())
                .filter(t -> !STOPWORDS.contains(t))
                .toList();
    }

    public static boolean isStopword(String token) {
        return token != null && STOPWORDS.contains(token.toLowerCase(Locale.ROOT));
    }
}
