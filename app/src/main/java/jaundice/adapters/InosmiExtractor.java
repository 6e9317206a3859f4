package jaundice.adapters;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Safelist;

import java.util.ArrayList;
import java.util.List;

// Extractor for inosmi.ru article pages.
public class InosmiExtractor implements ArticleExtractor {

    public static final String SOURCE_KEY = "inosmi_ru";

    // Tried in order; the first match is the article container.
    private static final String[] ARTICLE_SELECTORS = {"article.article", "div.article-body", "article"};

    // Page furniture that sits inside the article container.
    private static final String NOISE = "script, style, noscript, iframe, aside, figure, img, form, "
            + ".article-tags, .article-info, .article-footer, .article-media, .social-share";

    @Override
    public SanitizedArticle extract(String html, boolean plainText) throws ArticleNotFoundException {
        Document doc = Jsoup.parse(html == null ? "" : html);

        Element article = findArticle(doc);
        if (article == null) {
            throw new ArticleNotFoundException(SOURCE_KEY);
        }

        String title = titleOf(doc, article);
        article.select(NOISE).remove();
        article.select("h1").remove();

        String body = plainText ? toPlainText(article) : Jsoup.clean(article.html(), Safelist.basic());
        return new SanitizedArticle(title, body);
    }

    private static Element findArticle(Document doc) {
        for (String selector : ARTICLE_SELECTORS) {
            Element found = doc.selectFirst(selector);
            if (found != null) return found;
        }
        return null;
    }

    // Prefer the headline inside the article, then any h1, then <title>.
    private static String titleOf(Document doc, Element article) {
        Element h1 = article.selectFirst("h1");
        if (h1 == null) h1 = doc.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) return h1.text().trim();
        return doc.title().trim();
    }

    // One paragraph per line; falls back to the container text for pages without <p>.
    private static String toPlainText(Element article) {
        List<String> paragraphs = new ArrayList<>();
        for (Element p : article.select("p")) {
            String text = p.text().trim();
            if (!text.isEmpty()) paragraphs.add(text);
        }
        if (paragraphs.isEmpty()) {
            return article.text().trim();
        }
        return String.join("\n", paragraphs);
    }
}
