package jaundice.adapters;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ExtractorRegistryTest {

    @Test
    void resolvesRegisteredSite() throws Exception {
        ArticleExtractor extractor = ExtractorRegistry.defaults().resolve("https://inosmi.ru/social/20210205/249080434.html");
        assertInstanceOf(InosmiExtractor.class, extractor);
    }

    @Test
    void unknownSiteCarriesItsKey() {
        ArticleNotFoundException e = assertThrows(ArticleNotFoundException.class,
                () -> ExtractorRegistry.defaults().resolve("https://lenta.ru/news/2021/02/13/tesla/"));
        assertEquals("lenta_ru", e.getLabel());
    }

    @Test
    void malformedUrlCarriesTheUrl() {
        ArticleNotFoundException e = assertThrows(ArticleNotFoundException.class,
                () -> ExtractorRegistry.defaults().resolve("not a url"));
        assertEquals("not a url", e.getLabel());
    }

    @Test
    void sitesAreDistinct() throws Exception {
        ArticleExtractor lenta = (html, plain) -> new SanitizedArticle("lenta", html);
        ArticleExtractor inosmi = (html, plain) -> new SanitizedArticle("inosmi", html);
        ExtractorRegistry registry = new ExtractorRegistry(Map.of("lenta_ru", lenta, "inosmi_ru", inosmi));

        assertSame(lenta, registry.resolve("https://lenta.ru/news/1"));
        assertSame(inosmi, registry.resolve("https://www.inosmi.ru/politic/2.html"));
    }
}
