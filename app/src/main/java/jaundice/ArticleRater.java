package jaundice;

import jaundice.adapters.ExtractorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.function.Supplier;

// Rates a batch of URLs concurrently, one worker per URL.
// Outcomes come back in input order, one per URL, whatever happens to individual workers.
public class ArticleRater {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArticleRater.class);

    // Upper bound on a single wait while no worker has started yet.
    private static final long IDLE_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ArticleFetcher fetcher;
    private final ExtractorRegistry extractors;
    private final WordNormalizer normalizer;
    private final Supplier<ChargedLexicon> lexiconSource;
    private final Duration articleTimeout;
    private final int maxConcurrency;

    public ArticleRater(ArticleFetcher fetcher,
                        ExtractorRegistry extractors,
                        WordNormalizer normalizer,
                        Supplier<ChargedLexicon> lexiconSource,
                        Duration articleTimeout,
                        int maxConcurrency) {
        if (articleTimeout.isNegative() || articleTimeout.isZero()) {
            throw new IllegalArgumentException("articleTimeout must be positive: " + articleTimeout);
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
        }
        this.fetcher = fetcher;
        this.extractors = extractors;
        this.normalizer = SerializedNormalizer.guard(normalizer);
        this.lexiconSource = lexiconSource;
        this.articleTimeout = articleTimeout;
        this.maxConcurrency = maxConcurrency;
    }

    // Production wiring: jsoup fetcher, bundled extractors and lemma table.
    public static ArticleRater fromConfig(RaterConfig config) {
        return new ArticleRater(
                new JsoupArticleFetcher(),
                ExtractorRegistry.defaults(),
                DictionaryNormalizer.fromResource(DictionaryNormalizer.DEFAULT_RESOURCE),
                config::loadLexicon,
                config.articleTimeout(),
                config.maxConcurrency());
    }

    public List<ArticleOutcome> rate(List<String> urls) {
        if (urls.isEmpty()) return List.of();

        // Load before spawning anything, so a broken lexicon fails the whole batch up front
        ChargedLexicon lexicon = lexiconSource.get();
        TextTokenizer tokenizer = new TextTokenizer(normalizer);

        long start = System.nanoTime();
        // One thread per URL; WorkerSlots caps how many of them run at once
        ExecutorService pool = Executors.newFixedThreadPool(urls.size(), workerThreads());
        try {
            List<ArticleOutcome> outcomes = collect(urls, lexicon, tokenizer, pool);
            double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
            LOGGER.info("Rated {} urls in {} s", urls.size(), String.format(Locale.ROOT, "%.2f", elapsed));
            return outcomes;
        } finally {
            // Every outcome is recorded by now; whatever still runs has timed out and is abandoned.
            pool.shutdownNow();
        }
    }

    private List<ArticleOutcome> collect(List<String> urls,
                                         ChargedLexicon lexicon,
                                         TextTokenizer tokenizer,
                                         ExecutorService pool) {
        int n = urls.size();
        long timeoutNanos = articleTimeout.toNanos();

        // Completion service lets us record outcomes as workers finish
        ExecutorCompletionService<ArticleOutcome> completion = new ExecutorCompletionService<>(pool);
        List<ArticleWorker> workers = new ArrayList<>(n);
        List<Future<ArticleOutcome>> futures = new ArrayList<>(n);
        // 0 until the worker gets a slot; its deadline starts there
        AtomicLongArray startedAt = new AtomicLongArray(n);
        ArticleOutcome[] outcomes = new ArticleOutcome[n];
        WorkerSlots slots = new WorkerSlots(maxConcurrency, n);

        for (int i = 0; i < n; i++) {
            ArticleWorker worker = new ArticleWorker(urls.get(i), fetcher, extractors, tokenizer, lexicon, articleTimeout);
            int index = i;
            workers.add(worker);
            futures.add(completion.submit(() -> {
                slots.acquire(index);
                startedAt.set(index, System.nanoTime());
                try {
                    return worker.call();
                } finally {
                    slots.release(index);
                }
            }));
        }

        int pending = n;
        while (pending > 0) {
            pending -= expireOverdue(workers, futures, startedAt, outcomes, slots, timeoutNanos);
            if (pending == 0) break;

            long wait = nextDeadline(futures, startedAt, outcomes, timeoutNanos) - System.nanoTime();
            Future<ArticleOutcome> done;
            try {
                done = completion.poll(Math.max(wait, 0), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandonPending(futures, outcomes);
                break;
            }
            if (done == null || done.isCancelled()) continue;

            int index = futures.indexOf(done);
            if (outcomes[index] != null) continue;
            outcomes[index] = resultOf(done, workers.get(index));
            pending--;
        }

        return Arrays.asList(outcomes);
    }

    // Cancel workers whose deadline has passed and record them as timed out.
    private int expireOverdue(List<ArticleWorker> workers,
                              List<Future<ArticleOutcome>> futures,
                              AtomicLongArray startedAt,
                              ArticleOutcome[] outcomes,
                              WorkerSlots slots,
                              long timeoutNanos) {
        long now = System.nanoTime();
        int expired = 0;
        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] != null) continue;
            long started = startedAt.get(i);
            if (started == 0 || now - started < timeoutNanos) continue;

            // false means it completed just now; the result is already queued
            if (!futures.get(i).cancel(true)) continue;
            // The interrupt may be ignored; hand its slot to the next queued URL anyway
            slots.release(i);

            ArticleWorker worker = workers.get(i);
            LOGGER.info("Timed out {} while {}", worker.getUrl(), worker.getStage());
            outcomes[i] = ArticleOutcome.timeout();
            expired++;
        }
        return expired;
    }

    private long nextDeadline(List<Future<ArticleOutcome>> futures,
                              AtomicLongArray startedAt,
                              ArticleOutcome[] outcomes,
                              long timeoutNanos) {
        long next = System.nanoTime() + IDLE_POLL_NANOS;
        boolean anyStarted = false;
        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] != null || futures.get(i).isDone()) continue;
            long started = startedAt.get(i);
            if (started == 0) continue;
            long deadline = started + timeoutNanos;
            if (!anyStarted || deadline - next < 0) {
                next = deadline;
                anyStarted = true;
            }
        }
        return next;
    }

    private static ArticleOutcome resultOf(Future<ArticleOutcome> done, ArticleWorker worker) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            // ArticleWorker converts its own failures; only Errors get here
            LOGGER.warn("Worker for {} crashed", worker.getUrl(), e.getCause());
            String label = UrlUtil.sourceKey(worker.getUrl());
            return ArticleOutcome.parsingError(label == null ? worker.getUrl() : label);
        } catch (CancellationException e) {
            return ArticleOutcome.timeout();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ArticleOutcome.timeout();
        }
    }

    // The caller was interrupted: stop waiting and report everything unfinished as timed out.
    private static void abandonPending(List<Future<ArticleOutcome>> futures, ArticleOutcome[] outcomes) {
        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] != null) continue;
            futures.get(i).cancel(true);
            outcomes[i] = ArticleOutcome.timeout();
        }
    }

    // Concurrency permits, each returned exactly once: by the worker when it ends,
    // or by the orchestrator when it gives up on the worker.
    private static final class WorkerSlots {

        private final Semaphore permits;
        private final AtomicIntegerArray held;

        WorkerSlots(int maxConcurrency, int workers) {
            this.permits = new Semaphore(maxConcurrency);
            this.held = new AtomicIntegerArray(workers);
        }

        void acquire(int index) throws InterruptedException {
            permits.acquire();
            held.set(index, 1);
        }

        void release(int index) {
            if (held.compareAndSet(index, 1, 0)) permits.release();
        }
    }

    // Daemon threads, so a worker stuck in socket I/O past its deadline cannot hold the JVM open.
    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "article-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
