package scraper;

// Lightweight failure detail for failures.csv. Page is 0 for query-level failures.
public record FailureRecord(String query, int page, String url, String type, String message) { }
