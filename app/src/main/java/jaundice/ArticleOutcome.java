package jaundice;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

// Result of rating one URL. rate and wordCount are set only for OK outcomes.
public record ArticleOutcome(
        String title,
        ProcessingStatus status,
        Double rate,
        @SerializedName("count_words") Integer wordCount
) {

    public ArticleOutcome {
        Objects.requireNonNull(status, "status");
        boolean scored = rate != null && wordCount != null;
        boolean unscored = rate == null && wordCount == null;
        if (status == ProcessingStatus.OK ? !scored : !unscored) {
            throw new IllegalArgumentException("rate and wordCount must be present only for OK outcomes, got "
                    + status + " with rate=" + rate + ", wordCount=" + wordCount);
        }
    }

    public static ArticleOutcome ok(String title, double rate, int wordCount) {
        return new ArticleOutcome(title, ProcessingStatus.OK, rate, wordCount);
    }

    public static ArticleOutcome fetchError() {
        return new ArticleOutcome("URL not exist", ProcessingStatus.FETCH_ERROR, null, null);
    }

    public static ArticleOutcome parsingError(String sourceLabel) {
        return new ArticleOutcome("Статья на " + sourceLabel, ProcessingStatus.PARSING_ERROR, null, null);
    }

    public static ArticleOutcome timeout() {
        return new ArticleOutcome("Время ожидания ответа истекло", ProcessingStatus.TIMEOUT, null, null);
    }
}
