package jaundice;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

// Splits article text into normalized words, dropping prepositions and other short words.
public class TextTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    // Glyphs removed anywhere inside a token.
    private static final String QUOTES = "«»…";

    // Stripped from both ends of a token.
    private static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    // Kept even though it is not longer than MIN_LENGTH.
    static final String NEGATION = "не";

    private static final int MIN_LENGTH = 2;

    // How many tokens to process between interruption checks.
    private static final int CHECK_INTERVAL = 256;

    private final WordNormalizer normalizer;

    public TextTokenizer(WordNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public List<String> tokenize(String text) throws InterruptedException {
        List<String> words = new ArrayList<>();
        if (text == null || text.isBlank()) return words;

        int seen = 0;
        for (String raw : WHITESPACE.split(text.strip())) {
            if (++seen % CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Tokenizing interrupted after " + seen + " tokens");
            }

            String normalized = normalizer.normalize(cleanWord(raw));
            if (normalized.length() > MIN_LENGTH || normalized.equals(NEGATION)) {
                words.add(normalized);
            }
        }
        return words;
    }

    static String cleanWord(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (QUOTES.indexOf(c) < 0) sb.append(c);
        }

        int start = 0;
        int end = sb.length();
        while (start < end && PUNCTUATION.indexOf(sb.charAt(start)) >= 0) start++;
        while (end > start && PUNCTUATION.indexOf(sb.charAt(end - 1)) >= 0) end--;
        return sb.substring(start, end);
    }
}
