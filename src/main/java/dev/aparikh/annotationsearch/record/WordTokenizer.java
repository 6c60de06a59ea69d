package dev.aparikh.annotationsearch.record;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits record text into the lower-cased tokens counted by the {@code words} aggregation.
 *
 * <p>Tokens are runs of letters and digits. Tokens shorter than two characters and stop words are
 * dropped.
 */
public final class WordTokenizer {

    static final Set<String> DEFAULT_STOP_WORDS = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "am", "an", "and", "any", "are",
            "as", "at", "be", "because", "been", "before", "being", "below", "between", "both", "but",
            "by", "can", "could", "did", "do", "does", "doing", "down", "during", "each", "few", "for",
            "from", "further", "had", "has", "have", "having", "he", "her", "here", "hers", "herself",
            "him", "himself", "his", "how", "i", "if", "in", "into", "is", "it", "its", "itself", "just",
            "me", "more", "most", "my", "myself", "no", "nor", "not", "now", "of", "off", "on", "once",
            "only", "or", "other", "our", "ours", "ourselves", "out", "over", "own", "same", "she",
            "should", "so", "some", "such", "than", "that", "the", "their", "theirs", "them",
            "themselves", "then", "there", "these", "they", "this", "those", "through", "to", "too",
            "under", "until", "up", "very", "was", "we", "were", "what", "when", "where", "which",
            "while", "who", "whom", "why", "will", "with", "would", "you", "your", "yours", "yourself",
            "yourselves");

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 2;

    private final Set<String> stopWords;

    public WordTokenizer() {
        this(DEFAULT_STOP_WORDS);
    }

    public WordTokenizer(Collection<String> stopWords) {
        this.stopWords = stopWords.stream()
                .map(word -> word.toLowerCase(Locale.ROOT))
                .collect(java.util.stream.Collectors.toUnmodifiableSet());
    }

    /**
     * Tokenizes {@code text}, keeping duplicates and their order.
     */
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String token : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH && !stopWords.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
