package jaundice;

import jaundice.adapters.ArticleExtractor;
import jaundice.adapters.ArticleNotFoundException;
import jaundice.adapters.ExtractorRegistry;
import jaundice.adapters.SanitizedArticle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

// Rates a single URL: fetch, extract, tokenize, score.
// Never throws; every failure becomes an ArticleOutcome.
public class ArticleWorker implements Callable<ArticleOutcome> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArticleWorker.class);

    public enum Stage {
        PENDING,
        FETCHING,
        EXTRACTING,
        TOKENIZING,
        SCORING,
        DONE
    }

    private final String url;
    private final ArticleFetcher fetcher;
    private final ExtractorRegistry extractors;
    private final TextTokenizer tokenizer;
    private final ChargedLexicon lexicon;
    private final Duration timeout;

    private volatile Stage stage = Stage.PENDING;

    public ArticleWorker(String url,
                         ArticleFetcher fetcher,
                         ExtractorRegistry extractors,
                         TextTokenizer tokenizer,
                         ChargedLexicon lexicon,
                         Duration timeout) {
        this.url = url;
        this.fetcher = fetcher;
        this.extractors = extractors;
        this.tokenizer = tokenizer;
        this.lexicon = lexicon;
        this.timeout = timeout;
    }

    @Override
    public ArticleOutcome call() {
        long start = System.nanoTime();
        ArticleOutcome outcome = process();
        stage = Stage.DONE;

        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
        LOGGER.info("Analysis of {} finished in {} s: {}", url, String.format(Locale.ROOT, "%.2f", elapsed), outcome.status());
        return outcome;
    }

    private ArticleOutcome process() {
        try {
            // Depends on the URL only, so unsupported sites fail before any network call.
            ArticleExtractor extractor = extractors.resolve(url);

            stage = Stage.FETCHING;
            String html = fetcher.fetch(url, timeout);

            stage = Stage.EXTRACTING;
            SanitizedArticle article = extractor.extract(html, true);

            stage = Stage.TOKENIZING;
            List<String> words = tokenizer.tokenize(article.text());

            stage = Stage.SCORING;
            double rate = JaundiceRate.calculate(words, lexicon.words());
            return ArticleOutcome.ok(article.title(), rate, words.size());

        } catch (ArticleNotFoundException e) {
            LOGGER.info("No article for {}: {}", url, e.getMessage());
            return ArticleOutcome.parsingError(e.getLabel());

        } catch (SocketTimeoutException e) {
            LOGGER.info("Timed out fetching {}", url);
            return ArticleOutcome.timeout();

        } catch (FetchException e) {
            LOGGER.info(e.getMessage());
            return ArticleOutcome.fetchError();

        } catch (IOException e) {
            LOGGER.info("Failed to fetch {}: {}", url, e.getMessage());
            return ArticleOutcome.fetchError();

        } catch (InterruptedException e) {
            // Cancelled by the orchestrator once the deadline passed
            Thread.currentThread().interrupt();
            return ArticleOutcome.timeout();

        } catch (RuntimeException e) {
            // Malformed pages and extractor bugs are reported like an unsupported source
            LOGGER.warn("Unexpected failure while {} {}", stage, url, e);
            String label = UrlUtil.sourceKey(url);
            return ArticleOutcome.parsingError(label == null ? url : label);
        }
    }

    public String getUrl() {
        return url;
    }

    public Stage getStage() {
        return stage;
    }
}
