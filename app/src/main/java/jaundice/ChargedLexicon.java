package jaundice;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

// Charged words, loaded once before a batch and shared read-only by its workers.
public final class ChargedLexicon {

    public static final String DEFAULT_RESOURCE = "charged_dict/negative_words.txt";

    private final Set<String> words;

    public ChargedLexicon(Collection<String> words) {
        Set<String> normalized = new HashSet<>();
        for (String w : words) {
            String s = w.strip().toLowerCase(Locale.ROOT);
            if (!s.isEmpty()) normalized.add(s);
        }
        this.words = Set.copyOf(normalized);
    }

    // Union of every *.txt file in dir, one word per line.
    public static ChargedLexicon fromDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new IllegalStateException("Charged words directory not found: " + dir.toAbsolutePath());
        }
        Set<String> all = new HashSet<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.txt")) {
            for (Path file : files) {
                all.addAll(Files.readAllLines(file, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load charged words from " + dir, e);
        }
        return new ChargedLexicon(all);
    }

    public static ChargedLexicon fromResource(String name) {
        InputStream in = ChargedLexicon.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            throw new IllegalStateException("Charged words not found on classpath: " + name);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return new ChargedLexicon(reader.lines().toList());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load charged words from " + name, e);
        }
    }

    public Set<String> words() {
        return words;
    }

    public int size() {
        return words.size();
    }
}
