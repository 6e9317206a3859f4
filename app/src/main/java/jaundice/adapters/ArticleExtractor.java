package jaundice.adapters;

// Converts the raw HTML of one site's article page into title and body text.
@FunctionalInterface
public interface ArticleExtractor {

    // plainText=true returns the body as plain text, otherwise as cleaned-up HTML.
    SanitizedArticle extract(String html, boolean plainText) throws ArticleNotFoundException;
}
