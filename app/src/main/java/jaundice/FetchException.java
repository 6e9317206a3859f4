package jaundice;

import java.io.IOException;

// A page could not be downloaded: bad HTTP status or a network-level failure.
public class FetchException extends IOException {

    // -1 when the request never got an HTTP response.
    private final int httpStatus;
    private final String url;

    public FetchException(String url, int httpStatus, String message) {
        super(buildMessage(url, httpStatus, message));
        this.url = url;
        this.httpStatus = httpStatus;
    }

    public FetchException(String url, Throwable cause) {
        super(buildMessage(url, -1, cause.getMessage()), cause);
        this.url = url;
        this.httpStatus = -1;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getUrl() {
        return url;
    }

    private static String buildMessage(String url, int httpStatus, String message) {
        StringBuilder result = new StringBuilder("Failed to fetch ").append(url);
        if (httpStatus >= 0) {
            result.append(" (").append(httpStatus).append(")");
        }
        if (message != null && !message.isEmpty()) {
            result.append(": ").append(message);
        }
        return result.toString();
    }
}
