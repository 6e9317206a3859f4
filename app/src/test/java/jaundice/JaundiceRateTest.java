package jaundice;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JaundiceRateTest {

    @Test
    void emptyArticleScoresZero() {
        assertEquals(0.0, JaundiceRate.calculate(List.of(), Set.of()));
        assertEquals(0.0, JaundiceRate.calculate(List.of(), Set.of("аутсайдер")));
    }

    @Test
    void oneChargedWordOutOfThree() {
        double rate = JaundiceRate.calculate(List.of("все", "аутсайдер", "побег"), Set.of("аутсайдер", "банкротство"));
        assertTrue(rate > 33.0 && rate < 34.0, "rate was " + rate);
        assertEquals(33.33, rate);
    }

    @Test
    void repeatedChargedWordsCountEachTime() {
        assertEquals(50.0, JaundiceRate.calculate(List.of("шок", "шок", "кот", "дом"), Set.of("шок")));
    }

    @Test
    void emptyLexiconScoresZero() {
        assertEquals(0.0, JaundiceRate.calculate(List.of("шок", "кот"), Set.of()));
    }

    @Test
    void roundsHalfToEven() {
        // 1/800 = 0.125% and 3/800 = 0.375%
        assertEquals(0.12, JaundiceRate.calculate(words(800, 1), Set.of("шок")));
        assertEquals(0.38, JaundiceRate.calculate(words(800, 3), Set.of("шок")));
    }

    @Test
    void growsWithChargedWordCount() {
        double previous = -1;
        for (int charged = 0; charged <= 7; charged++) {
            double rate = JaundiceRate.calculate(words(7, charged), Set.of("шок"));
            assertTrue(rate >= previous, charged + " charged words scored " + rate + " < " + previous);
            previous = rate;
        }
        assertEquals(100.0, previous);
    }

    private static List<String> words(int total, int charged) {
        List<String> words = new ArrayList<>(Collections.nCopies(total - charged, "кот"));
        words.addAll(Collections.nCopies(charged, "шок"));
        return words;
    }
}
