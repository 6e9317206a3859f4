package jaundice;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

// Renders outcomes as JSON for the HTTP API and as text blocks for the console.
public class OutcomeFormatter {

    // rate and count_words must appear as null for failed articles
    private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    public static String toJson(List<ArticleOutcome> outcomes) {
        return GSON.toJson(outcomes);
    }

    public static String errorJson(String message) {
        return GSON.toJson(Map.of("error", message));
    }

    public static String toText(ArticleOutcome outcome) {
        return "Заголовок: " + outcome.title() + "\n"
                + "Статус: " + outcome.status() + "\n"
                + "Рейтинг: " + outcome.rate() + "\n"
                + "Слов в статье: " + outcome.wordCount() + "\n";
    }

    // Count of outcomes per status, in enum order, zeros included.
    public static Map<ProcessingStatus, Integer> countByStatus(List<ArticleOutcome> outcomes) {
        Map<ProcessingStatus, Integer> counts = new EnumMap<>(ProcessingStatus.class);
        for (ProcessingStatus s : ProcessingStatus.values()) counts.put(s, 0);
        for (ArticleOutcome o : outcomes) counts.merge(o.status(), 1, Integer::sum);
        return counts;
    }
}
