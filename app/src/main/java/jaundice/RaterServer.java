package jaundice;

import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

// HTTP front end: GET /?urls=<url1>,<url2>,... returns the outcomes as JSON.
public class RaterServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RaterServer.class);

    private final ArticleRater rater;
    private final int maxUrls;

    public RaterServer(ArticleRater rater, int maxUrls) {
        this.rater = rater;
        this.maxUrls = maxUrls;
    }

    // port 0 picks a free port; read it back with app.port().
    public Javalin start(int port) {
        Javalin app = Javalin.create(cfg -> cfg.http.defaultContentType = "application/json");
        app.get("/", this::handleRate);
        app.start(port);
        LOGGER.info("Listening on port {}", app.port());
        return app;
    }

    void handleRate(Context ctx) {
        String raw = ctx.queryParam("urls");
        List<String> urls = UrlUtil.splitUrls(raw);
        if (urls.isEmpty()) {
            ctx.status(400).result(OutcomeFormatter.errorJson("query parameter 'urls' is required"));
            return;
        }
        if (urls.size() > maxUrls) {
            ctx.status(400).result(OutcomeFormatter.errorJson(
                    "too many urls in request, should be " + maxUrls + " or less"));
            return;
        }

        List<ArticleOutcome> outcomes = rater.rate(urls);
        ctx.result(OutcomeFormatter.toJson(outcomes));
    }
}
