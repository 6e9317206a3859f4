package jaundice;

import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

public class JsoupArticleFetcher implements ArticleFetcher {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";

    // Added before every request. Only tests set this, to push a fetch past its deadline.
    private final Duration simulatedLatency;

    public JsoupArticleFetcher() {
        this(Duration.ZERO);
    }

    public JsoupArticleFetcher(Duration simulatedLatency) {
        this.simulatedLatency = simulatedLatency;
    }

    @Override
    public String fetch(String url, Duration timeout) throws IOException, InterruptedException {
        if (!simulatedLatency.isZero()) {
            Thread.sleep(simulatedLatency.toMillis());
        }

        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(USER_AGENT)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "ru-RU,ru;q=0.9,en;q=0.8")
                    .header("Cache-Control", "no-cache")
                    .timeout((int) timeout.toMillis())
                    .followRedirects(true)
                    // jsoup cuts bodies at 2 MB by default; a truncated article scores wrong
                    .maxBodySize(0)
                    .execute();
            return response.body();

        } catch (HttpStatusException e) {
            throw new FetchException(url, e.getStatusCode(), e.getMessage());

        } catch (SocketTimeoutException e) {
            // The caller maps this to a timeout rather than a fetch failure
            throw e;

        } catch (IOException | IllegalArgumentException e) {
            // IllegalArgumentException: jsoup rejects URLs it cannot request (bad scheme, no host)
            throw new FetchException(url, e);
        }
    }
}
