package scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

// Scrapes every result page of one query and assembles them in page order.
public class QueryScraper {

    private static final Logger log = LoggerFactory.getLogger(QueryScraper.class);

    private final PageSource pageSource;
    private final PageParser parser;

    // Runs page fetches; must not be the pool that runs queries
    private final ExecutorService pagePool;

    private final FailureLogger failureLogger;
    private final String searchBaseUrl;
    private final int pages;

    public QueryScraper(PageSource pageSource,
                        PageParser parser,
                        ExecutorService pagePool,
                        FailureLogger failureLogger,
                        String searchBaseUrl,
                        int pages) {
        if (pages < 1) throw new IllegalArgumentException("pages must be >= 1: " + pages);
        this.pageSource = pageSource;
        this.parser = parser;
        this.pagePool = pagePool;
        this.failureLogger = failureLogger;
        this.searchBaseUrl = searchBaseUrl;
        this.pages = pages;
    }

    public QueryDocument scrape(String query) {
        List<PageRequest> requests = PageRequest.forQuery(searchBaseUrl, query, pages);

        // Start all pages at once; the page limiter decides how many really run.
        List<Future<FetchOutcome>> futures = new ArrayList<>(requests.size());
        for (PageRequest request : requests) {
            futures.add(submit(request));
        }

        // Wait for every page, then assemble strictly by page index.
        List<PageResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            PageRequest request = requests.get(i);
            String html = await(request, futures.get(i));
            results.add(parse(request, html));
        }

        QueryDocument document = new QueryDocument(query, results);
        log.info("Scraped {} pages for query {} ({} results)", pages, query, document.totalResults());
        return document;
    }

    private Future<FetchOutcome> submit(PageRequest request) {
        try {
            return pagePool.submit(() -> pageSource.fetch(request.url()));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // Content of one page, or null if it failed in any way.
    private String await(PageRequest request, Future<FetchOutcome> future) {
        FetchOutcome outcome;
        try {
            outcome = future.get();
        } catch (ExecutionException e) {
            recordCrash(request, e.getCause());
            return null;
        } catch (CancellationException e) {
            recordCrash(request, e);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            recordCrash(request, e);
            return null;
        }

        if (outcome == null) {
            recordCrash(request, new IllegalStateException("page source returned no outcome"));
            return null;
        }
        if (!outcome.isSuccess()) {
            failureLogger.add(new FailureRecord(request.query(), request.pageIndex(), request.url(),
                    outcome.status().name(), outcome.detail()));
            return null;
        }
        return outcome.content();
    }

    // A parser bug costs one page, never the page list.
    private PageResult parse(PageRequest request, String html) {
        try {
            return parser.parse(html, request.query(), request.pageIndex());
        } catch (RuntimeException e) {
            log.error("Parser failed on page {} for {}", request.pageIndex(), request.query(), e);
            failureLogger.add(new FailureRecord(request.query(), request.pageIndex(), request.url(),
                    "PARSE_FAILED", String.valueOf(e)));
            return PageResult.empty(request.pageIndex());
        }
    }

    private void recordCrash(PageRequest request, Throwable cause) {
        log.error("Error in page {} for {}: {}", request.pageIndex(), request.query(), String.valueOf(cause));
        failureLogger.add(new FailureRecord(request.query(), request.pageIndex(), request.url(),
                "CRASH", String.valueOf(cause)));
    }
}
