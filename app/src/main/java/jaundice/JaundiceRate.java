package jaundice;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Set;

// Share of charged words in an article.
public final class JaundiceRate {

    private JaundiceRate() { }

    // Percentage of words found in the charged-word set, rounded half-even to 2 decimals.
    // An empty article scores 0.0.
    public static double calculate(List<String> words, Set<String> chargedWords) {
        if (words.isEmpty()) return 0.0;

        long charged = words.stream().filter(chargedWords::contains).count();
        double score = charged * 100.0 / words.size();
        return BigDecimal.valueOf(score).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
