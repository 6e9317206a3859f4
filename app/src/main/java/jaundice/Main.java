package jaundice;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

// CLI entry point: rate a list of URLs once, or serve the HTTP API.
public class Main {

    private static final String USAGE = """
            Usage: rate <url> [<url> ...]
                   serve [port]
            Example: rate https://inosmi.ru/social/20210205/249080434.html
            Environment: MAX_WAITING_TIME, MAX_URLS, MAX_CONCURRENCY, CHARGED_DICT_DIR, PORT
            """;

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println(USAGE);
            System.exit(1);
        }

        RaterConfig config;
        try {
            config = RaterConfig.fromEnv();
            if (args[0].equals("serve") && args.length > 1) {
                config = config.withPort(RaterConfig.parseInt("port", args[1]));
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        switch (args[0]) {
            case "rate" -> rate(config, Arrays.asList(args).subList(1, args.length));
            case "serve" -> serve(config);
            default -> {
                System.err.println("Unknown command: " + args[0]);
                System.err.println(USAGE);
                System.exit(1);
            }
        }
    }

    private static void rate(RaterConfig config, List<String> urls) {
        if (urls.isEmpty()) {
            System.err.println("No URLs given");
            System.exit(1);
        }
        if (urls.size() > config.maxUrls()) {
            System.err.println("Too many URLs: " + urls.size() + " (MAX_URLS=" + config.maxUrls() + ")");
            System.exit(1);
        }

        ArticleRater rater = ArticleRater.fromConfig(config);
        List<ArticleOutcome> outcomes = rater.rate(urls);

        for (ArticleOutcome outcome : outcomes) {
            System.out.println(OutcomeFormatter.toText(outcome));
        }
        printFinalSummary(outcomes);
    }

    private static void serve(RaterConfig config) {
        ArticleRater rater = ArticleRater.fromConfig(config);
        new RaterServer(rater, config.maxUrls()).start(config.port());
    }

    // Print a minimal end-of-run summary.
    private static void printFinalSummary(List<ArticleOutcome> outcomes) {
        Map<ProcessingStatus, Integer> counts = OutcomeFormatter.countByStatus(outcomes);
        System.out.println("==== Run summary ====");
        System.out.println("Rated OK     : " + counts.get(ProcessingStatus.OK));
        System.out.println("Fetch errors : " + counts.get(ProcessingStatus.FETCH_ERROR));
        System.out.println("Parse errors : " + counts.get(ProcessingStatus.PARSING_ERROR));
        System.out.println("Timeouts     : " + counts.get(ProcessingStatus.TIMEOUT));
    }
}
