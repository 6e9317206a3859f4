package jaundice;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RaterConfigTest {

    @Test
    void defaultsWhenEnvironmentIsEmpty() {
        RaterConfig config = RaterConfig.fromEnv(Map.of());

        assertEquals(Duration.ofSeconds(3), config.articleTimeout());
        assertEquals(10, config.maxUrls());
        assertEquals(10, config.maxConcurrency());
        assertEquals(8080, config.port());
        assertNull(config.chargedDictDir());
    }

    @Test
    void readsOverrides() {
        RaterConfig config = RaterConfig.fromEnv(Map.of(
                "MAX_WAITING_TIME", "5",
                "MAX_URLS", "3",
                "MAX_CONCURRENCY", "2",
                "PORT", "9000",
                "CHARGED_DICT_DIR", "/tmp/charged"));

        assertEquals(Duration.ofSeconds(5), config.articleTimeout());
        assertEquals(3, config.maxUrls());
        assertEquals(2, config.maxConcurrency());
        assertEquals(9000, config.port());
        assertEquals(Path.of("/tmp/charged"), config.chargedDictDir());
    }

    @Test
    void rejectsBadNumbers() {
        assertThrows(IllegalArgumentException.class, () -> RaterConfig.fromEnv(Map.of("MAX_WAITING_TIME", "soon")));
        assertThrows(IllegalArgumentException.class, () -> RaterConfig.fromEnv(Map.of("MAX_WAITING_TIME", "0")));
        assertThrows(IllegalArgumentException.class, () -> RaterConfig.fromEnv(Map.of("MAX_URLS", "-1")));
    }

    @Test
    void portArgumentOverridesEnvironment() {
        RaterConfig config = RaterConfig.fromEnv(Map.of("PORT", "9000"));

        assertEquals(7070, config.withPort(RaterConfig.parseInt("port", " 7070 ")).port());
        assertThrows(IllegalArgumentException.class, () -> RaterConfig.parseInt("port", "eighty"));
        assertThrows(IllegalArgumentException.class, () -> config.withPort(70_000));
    }

    @Test
    void loadsBundledLexiconByDefault() {
        assertTrue(RaterConfig.fromEnv(Map.of()).loadLexicon().size() > 0);
    }

    @Test
    void loadsConfiguredDirectory(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("words.txt"), "шок\nужас\n");
        RaterConfig config = RaterConfig.fromEnv(Map.of("CHARGED_DICT_DIR", dir.toString()));

        assertEquals(2, config.loadLexicon().size());
    }

    @Test
    void configuredButMissingDirectoryIsAnError(@TempDir Path dir) {
        RaterConfig config = RaterConfig.fromEnv(Map.of("CHARGED_DICT_DIR", dir.resolve("missing").toString()));

        assertThrows(IllegalStateException.class, config::loadLexicon);
    }
}
