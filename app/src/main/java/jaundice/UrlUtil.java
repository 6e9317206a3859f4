package jaundice;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class UrlUtil {

    // Derive the extractor lookup key from a URL's host.
    // "https://www.inosmi.ru/social/1.html" -> "inosmi_ru". Returns null when the URL has no host.
    public static String sourceKey(String url) {
        if (url == null || url.isBlank()) return null;

        String host;
        try {
            URI uri = new URI(url.trim());
            host = uri.getHost();
            // Scheme-less input like "lenta.ru/news/1" parses as a path
            if (host == null && uri.getScheme() == null) {
                host = new URI("http://" + url.trim()).getHost();
            }
        } catch (URISyntaxException e) {
            return null;
        }
        if (host == null || !host.contains(".")) return null;

        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) host = host.substring(4);
        return host.replace('.', '_');
    }

    // Split a comma separated URL list, dropping blanks. Duplicates are kept.
    public static List<String> splitUrls(String raw) {
        List<String> urls = new ArrayList<>();
        if (raw == null) return urls;
        for (String part : raw.split(",")) {
            String s = part.trim();
            if (!s.isEmpty()) urls.add(s);
        }
        return urls;
    }
}
