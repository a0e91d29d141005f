package scraper;

import java.util.List;

// Parsed results of one result page. Results are empty when the page could not be fetched.
public record PageResult(int page, List<ResultRecord> results) {

    public PageResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static PageResult empty(int page) {
        return new PageResult(page, List.of());
    }
}
