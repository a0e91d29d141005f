package scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final QueryScraper scraper;

    private final Sink sink;

    // At most this many queries scrape (and save) at the same time
    private final ConcurrencyLimiter queryLimiter;

    private final FailureLogger failureLogger;

    // What happened to the query at position index. error is null when it was stored.
    private record TaskResult(int index, String query, int written, String error) {
        boolean stored() {
            return error == null;
        }
    }

    public BatchRunner(QueryScraper scraper, Sink sink, ConcurrencyLimiter queryLimiter, FailureLogger failureLogger) {
        this.scraper = scraper;
        this.sink = sink;
        this.queryLimiter = queryLimiter;
        this.failureLogger = failureLogger;
    }

    // Scrape every query and hand each document to the sink as soon as it is ready.
    // Queries finish in any order; one query failing never stops the others.
    public BatchReport run(List<String> queries) {
        if (queries.isEmpty()) {
            log.info("No queries to scrape");
            return new BatchReport(0, 0, 0, List.of());
        }

        log.info("Scraping {} queries with {}", queries.size(), queryLimiter);
        ExecutorService pool = Executors.newFixedThreadPool(queryLimiter.limit(), threadsNamed("query"));

        // Completion service lets us process queries as they finish
        ExecutorCompletionService<TaskResult> completion = new ExecutorCompletionService<>(pool);
        int submitted = 0;
        // Keyed by input position so repeated queries each keep their entry
        Map<Integer, QueryFailure> failed = new TreeMap<>();
        for (int i = 0; i < queries.size(); i++) {
            int index = i;
            String query = queries.get(i);
            try {
                completion.submit(() -> process(index, query));
                submitted++;
            } catch (RejectedExecutionException e) {
                failureLogger.add(new FailureRecord(query, 0, "", "REJECTED", e.getMessage()));
                failed.put(index, new QueryFailure(query, "REJECTED: " + e.getMessage()));
            }
        }

        int stored = 0;
        int recordsWritten = 0;
        try {
            for (int done = 0; done < submitted; done++) {
                TaskResult result;
                try {
                    result = completion.take().get();
                } catch (ExecutionException e) {
                    // process() catches everything, so this is a bug rather than a query failure
                    log.error("Query task crashed", e.getCause());
                    failureLogger.add(new FailureRecord("<unknown>", 0, "", "CRASH", String.valueOf(e.getCause())));
                    continue;
                }

                if (result.stored()) {
                    stored++;
                    recordsWritten += result.written();
                } else {
                    failed.put(result.index(), new QueryFailure(result.query(), result.error()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted with {} of {} queries stored", stored, queries.size());
        } finally {
            shutdownGracefully(pool);
        }

        log.info("Batch finished: {}/{} queries stored, {} results", stored, queries.size(), recordsWritten);
        return new BatchReport(queries.size(), stored, recordsWritten, new ArrayList<>(failed.values()));
    }

    // One query end to end, holding a query slot for the scrape and the save.
    private TaskResult process(int index, String query) {
        String destinationId = UrlUtil.toSafeName(query);
        try (ConcurrencyLimiter.Permit slot = queryLimiter.acquire()) {
            log.debug("Scraping query {} -> {}", query, destinationId);
            QueryDocument document = scraper.scrape(query);
            int written = sink.store(destinationId, document);
            return new TaskResult(index, query, written, null);

        } catch (IOException e) {
            log.error("Could not save results for {} to {}: {}", query, destinationId, e.getMessage());
            failureLogger.add(new FailureRecord(query, 0, destinationId, "SAVE_FAILED", e.getMessage()));
            return new TaskResult(index, query, 0, "SAVE_FAILED: " + e.getMessage());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failureLogger.add(new FailureRecord(query, 0, destinationId, "INTERRUPTED", "waiting for a query slot"));
            return new TaskResult(index, query, 0, "INTERRUPTED");

        } catch (RuntimeException e) {
            log.error("Query {} failed", query, e);
            failureLogger.add(new FailureRecord(query, 0, destinationId, "CRASH", String.valueOf(e)));
            return new TaskResult(index, query, 0, "CRASH: " + e);
        }
    }

    // Stop workers with a small grace period.
    static void shutdownGracefully(ExecutorService pool) {
        // Stop accepting new tasks
        pool.shutdown();
        try {
            // Wait a bit for tasks to finish
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    // Worker threads named <prefix>-1, <prefix>-2, ... so log lines show who did what.
    static ThreadFactory threadsNamed(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
