package jaundice;

import java.io.IOException;
import java.time.Duration;

// Downloads the HTML of one page.
@FunctionalInterface
public interface ArticleFetcher {

    // Throws FetchException for bad statuses and network failures,
    // SocketTimeoutException when the server is slower than timeout.
    String fetch(String url, Duration timeout) throws IOException, InterruptedException;
}
