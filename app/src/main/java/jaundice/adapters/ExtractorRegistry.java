package jaundice.adapters;

import jaundice.UrlUtil;

import java.util.Map;

// Maps a URL to the extractor registered for its site.
public class ExtractorRegistry {

    private final Map<String, ArticleExtractor> extractors;

    public ExtractorRegistry(Map<String, ArticleExtractor> extractors) {
        this.extractors = Map.copyOf(extractors);
    }

    // Registry with every extractor shipped in this package.
    public static ExtractorRegistry defaults() {
        return new ExtractorRegistry(Map.of(InosmiExtractor.SOURCE_KEY, new InosmiExtractor()));
    }

    public ArticleExtractor resolve(String url) throws ArticleNotFoundException {
        String key = UrlUtil.sourceKey(url);
        if (key == null) {
            // Malformed URLs are reported the same way as unknown sites.
            throw new ArticleNotFoundException(url);
        }
        ArticleExtractor extractor = extractors.get(key);
        if (extractor == null) {
            throw new ArticleNotFoundException(key);
        }
        return extractor;
    }
}
