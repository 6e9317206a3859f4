package jaundice;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

// Lemmatizes through a word-form -> lemma table. Unknown words are returned lower-cased.
// Table format: one "form<TAB>lemma" pair per line, '#' starts a comment.
public class DictionaryNormalizer implements WordNormalizer {

    public static final String DEFAULT_RESOURCE = "lemmas.tsv";

    private final Map<String, String> lemmas;

    public DictionaryNormalizer(Map<String, String> lemmas) {
        this.lemmas = Map.copyOf(lemmas);
    }

    public static DictionaryNormalizer fromResource(String name) {
        InputStream in = DictionaryNormalizer.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            throw new IllegalStateException("Lemma dictionary not found on classpath: " + name);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return new DictionaryNormalizer(read(reader));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read lemma dictionary " + name, e);
        }
    }

    public static DictionaryNormalizer fromFile(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new DictionaryNormalizer(read(reader));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read lemma dictionary " + path, e);
        }
    }

    @Override
    public String normalize(String word) {
        if (word == null || word.isEmpty()) return "";
        String lower = word.toLowerCase(Locale.ROOT);
        return lemmas.getOrDefault(lower, lower);
    }

    // Immutable after construction.
    @Override
    public boolean isThreadSafe() {
        return true;
    }

    private static Map<String, String> read(Reader source) throws IOException {
        Map<String, String> result = new HashMap<>();
        BufferedReader reader = new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            int commentIdx = line.indexOf('#');
            if (commentIdx >= 0) line = line.substring(0, commentIdx);
            line = line.strip();
            if (line.isEmpty()) continue;

            String[] parts = line.split("\t");
            if (parts.length != 2) continue;
            result.put(parts[0].strip().toLowerCase(Locale.ROOT), parts[1].strip().toLowerCase(Locale.ROOT));
        }
        return result;
    }
}
