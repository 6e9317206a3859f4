package jaundice.adapters;

// Title and body of an article after the site-specific markup has been removed.
public record SanitizedArticle(String title, String text) { }
