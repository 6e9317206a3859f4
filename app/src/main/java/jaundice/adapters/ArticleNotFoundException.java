package jaundice.adapters;

// No extractor could produce an article for a page: unknown site, malformed URL,
// or a page without an article body.
public class ArticleNotFoundException extends Exception {

    private final String label;

    public ArticleNotFoundException(String label) {
        super("Article source not found: " + label);
        this.label = label;
    }

    // Source key (e.g. "lenta_ru") or the raw URL when no key could be derived.
    public String getLabel() {
        return label;
    }
}
