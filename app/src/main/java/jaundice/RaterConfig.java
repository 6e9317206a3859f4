package jaundice;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

// Settings for a rating run, read from the environment.
public record RaterConfig(
        Duration articleTimeout,
        int maxUrls,
        int maxConcurrency,
        Path chargedDictDir,  // null means the bundled word list
        int port
) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 3;
    public static final int DEFAULT_MAX_URLS = 10;
    public static final int DEFAULT_MAX_CONCURRENCY = 10;
    public static final int DEFAULT_PORT = 8080;

    public RaterConfig {
        if (articleTimeout == null || articleTimeout.isNegative() || articleTimeout.isZero()) {
            throw new IllegalArgumentException("articleTimeout must be positive: " + articleTimeout);
        }
        if (maxUrls < 1) throw new IllegalArgumentException("maxUrls must be >= 1: " + maxUrls);
        if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    }

    public static RaterConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static RaterConfig fromEnv(Map<String, String> env) {
        int timeoutSeconds = parseInt(env, "MAX_WAITING_TIME", DEFAULT_TIMEOUT_SECONDS);
        int maxUrls = parseInt(env, "MAX_URLS", DEFAULT_MAX_URLS);
        int maxConcurrency = parseInt(env, "MAX_CONCURRENCY", DEFAULT_MAX_CONCURRENCY);
        int port = parseInt(env, "PORT", DEFAULT_PORT);

        String dictDir = env.get("CHARGED_DICT_DIR");
        Path chargedDictDir = dictDir == null || dictDir.isBlank() ? null : Path.of(dictDir);

        return new RaterConfig(Duration.ofSeconds(timeoutSeconds), maxUrls, maxConcurrency, chargedDictDir, port);
    }

    public RaterConfig withPort(int newPort) {
        return new RaterConfig(articleTimeout, maxUrls, maxConcurrency, chargedDictDir, newPort);
    }

    // Reads the charged words. A configured directory that does not exist is an error, not a fallback.
    public ChargedLexicon loadLexicon() {
        if (chargedDictDir == null) {
            return ChargedLexicon.fromResource(ChargedLexicon.DEFAULT_RESOURCE);
        }
        return ChargedLexicon.fromDirectory(chargedDictDir);
    }

    private static int parseInt(Map<String, String> env, String name, int defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) return defaultValue;
        return parseInt(name, raw);
    }

    // Shared by environment variables and CLI arguments.
    public static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + raw, e);
        }
    }
}
