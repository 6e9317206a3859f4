package jaundice;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TextTokenizerTest {

    private final TextTokenizer tokenizer =
            new TextTokenizer(DictionaryNormalizer.fromResource(DictionaryNormalizer.DEFAULT_RESOURCE));

    @Test
    void dropsShortWordsAndKeepsHyphenatedOnes() throws Exception {
        assertEquals(List.of("во-первых", "хотеть", "чтобы"), tokenizer.tokenize("Во-первых, он хочет, чтобы"));
    }

    @Test
    void stripsQuotesAndPunctuation() throws Exception {
        assertEquals(List.of("удивительно", "это", "стать", "начало"),
                tokenizer.tokenize("«Удивительно, но это стало началом!»"));
    }

    @Test
    void keepsNegationParticle() throws Exception {
        assertEquals(List.of("не", "хотеть"), tokenizer.tokenize("Не хочет, ни за"));
    }

    @Test
    void removesEllipsisInsideWords() throws Exception {
        assertEquals(List.of("начало", "стать"), tokenizer.tokenize("…началом… стало..."));
    }

    @Test
    void splitsOnAnyWhitespace() throws Exception {
        assertEquals(List.of("это", "хотеть"), tokenizer.tokenize("  это\n\tхочет  "));
    }

    @Test
    void blankTextHasNoWords() throws Exception {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("   \n ").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
    }

    @Test
    void punctuationOnlyTokensAreDropped() throws Exception {
        assertEquals(List.of("стать"), tokenizer.tokenize("— ... !!! стало ?"));
    }

    @Test
    void cleanWordOnlyStripsEnds() {
        assertEquals("во-первых", TextTokenizer.cleanWord("(во-первых),"));
        assertEquals("США", TextTokenizer.cleanWord("«США»."));
        assertEquals("", TextTokenizer.cleanWord("?!"));
    }

    @Test
    void stopsWhenInterrupted() {
        String longText = "слово ".repeat(1000);
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> tokenizer.tokenize(longText));
        } finally {
            Thread.interrupted();
        }
    }
}
