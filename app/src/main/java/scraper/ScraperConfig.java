package scraper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

// Settings for one scrape run. Defaults come from scraper.properties, -Dscraper.* overrides them.
public record ScraperConfig(
        Path inputFile,
        ProxyEndpoint proxy,
        Path outputDir,
        String searchUrl,
        int pages,
        int retries,
        Duration retryDelay,
        Duration attemptTimeout,
        int pageConcurrency,
        int queryConcurrency
) {

    public static final String DEFAULTS_RESOURCE = "/scraper.properties";

    public ScraperConfig {
        requirePositive(pages, "pages");
        requirePositive(retries, "retries");
        requirePositive(pageConcurrency, "page-concurrency");
        requirePositive(queryConcurrency, "query-concurrency");
        if (retryDelay.isNegative()) throw new IllegalArgumentException("retry-delay-ms must be >= 0");
        if (attemptTimeout.isNegative()) throw new IllegalArgumentException("timeout-ms must be >= 0");
        if (!UrlUtil.isHttpLike(searchUrl)) {
            throw new IllegalArgumentException("search-url must be an http(s) URL: " + searchUrl);
        }
    }

    // Build from the classpath defaults with system properties on top.
    // outputDir may be null to use the configured scraper.output-dir.
    public static ScraperConfig load(Path inputFile, String proxyUrl, Path outputDir) {
        Properties props = new Properties();
        props.putAll(defaults());
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("scraper.")) props.setProperty(key, System.getProperty(key));
        }
        return fromProperties(props, inputFile, proxyUrl, outputDir);
    }

    public static ScraperConfig fromProperties(Properties props, Path inputFile, String proxyUrl, Path outputDir) {
        Path out = outputDir != null ? outputDir : Path.of(props.getProperty("scraper.output-dir", "."));
        return new ScraperConfig(
                inputFile,
                ProxyEndpoint.parse(proxyUrl),
                out,
                props.getProperty("scraper.search-url", "https://www.ecosia.org/search").trim(),
                intProp(props, "scraper.pages", 5),
                intProp(props, "scraper.retries", 3),
                Duration.ofMillis(intProp(props, "scraper.retry-delay-ms", 2000)),
                Duration.ofMillis(intProp(props, "scraper.timeout-ms", 15000)),
                intProp(props, "scraper.page-concurrency", 10),
                intProp(props, "scraper.query-concurrency", 3));
    }

    // Enough workers for every page of every query that may be in flight at once.
    public int pagePoolSize() {
        return queryConcurrency * pages;
    }

    private static Properties defaults() {
        Properties props = new Properties();
        try (InputStream in = ScraperConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + DEFAULTS_RESOURCE, e);
        }
        return props;
    }

    // Strict integer parsing with a clean error message.
    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw);
        }
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) throw new IllegalArgumentException(name + " must be >= 1: " + value);
    }
}
