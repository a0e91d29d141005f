package scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.function.Supplier;

public class PageFetcher implements PageSource {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final ProxyTransport transport;

    // Shared by every fetch in the run, across all queries
    private final ConcurrencyLimiter pageLimiter;

    private final int retries;
    private final Duration retryDelay;

    // Fresh client identity per attempt
    private final Supplier<String> userAgents;

    public PageFetcher(ProxyTransport transport, ConcurrencyLimiter pageLimiter, int retries, Duration retryDelay) {
        this(transport, pageLimiter, retries, retryDelay, UserAgents::random);
    }

    public PageFetcher(ProxyTransport transport,
                       ConcurrencyLimiter pageLimiter,
                       int retries,
                       Duration retryDelay,
                       Supplier<String> userAgents) {
        if (retries < 1) throw new IllegalArgumentException("retries must be >= 1: " + retries);
        this.transport = transport;
        this.pageLimiter = pageLimiter;
        this.retries = retries;
        this.retryDelay = retryDelay;
        this.userAgents = userAgents;
    }

    // Fetch one URL, retrying failed attempts. Never throws for network problems.
    @Override
    public FetchOutcome fetch(String url) {
        AttemptResult last = null;
        int attempt = 0;
        while (attempt < retries) {
            attempt++;
            String userAgent = userAgents.get();
            log.debug("Requesting {} (attempt {}/{}) as {}", url, attempt, retries, userAgent);

            last = attemptOnce(url, userAgent);
            if (last.isOk()) {
                String body = last.body();
                log.debug("Fetched {}, HTML length: {}, first 100 chars: {}",
                        url, body.length(), body.substring(0, Math.min(100, body.length())));
                return FetchOutcome.success(url, body, attempt);
            }

            log.error("Attempt {}/{} failed for {}: {} ({})", attempt, retries, url, last.status(), last.detail());
            if (Thread.currentThread().isInterrupted()) break;

            // Back off between attempts, never after the last one
            if (attempt < retries && !pause()) break;
        }

        log.error("All {} attempts failed for {}", attempt, url);
        return FetchOutcome.absent(url, last, attempt);
    }

    // One attempt: take a page slot, open a fresh exchange, read a 200 body.
    // Both the exchange and the slot are released on every path.
    private AttemptResult attemptOnce(String url, String userAgent) {
        try (ConcurrencyLimiter.Permit slot = pageLimiter.acquire();
             ProxyExchange exchange = transport.get(url, userAgent)) {

            int status = exchange.statusCode();
            if (status != 200) {
                return AttemptResult.httpStatus(status);
            }
            return AttemptResult.ok(exchange.body());

        } catch (SocketTimeoutException e) {
            return AttemptResult.timeout(e.getMessage());

        } catch (IOException e) {
            return AttemptResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());

        } catch (UncheckedIOException e) {
            return AttemptResult.failed(e.getCause().getClass().getSimpleName() + ": " + e.getCause().getMessage());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AttemptResult.failed("interrupted while waiting for a page slot");
        }
    }

    // Returns false if interrupted, which ends the retry loop.
    private boolean pause() {
        if (retryDelay.isZero() || retryDelay.isNegative()) return true;
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
