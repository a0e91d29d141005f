package scraper;

import java.util.ArrayList;
import java.util.List;

// One page to fetch for a query. Page indexes are 1-based.
public record PageRequest(String query, int pageIndex, String url) {

    public static PageRequest of(String searchBaseUrl, String query, int pageIndex) {
        return new PageRequest(query, pageIndex, UrlUtil.searchUrl(searchBaseUrl, query, pageIndex));
    }

    // Requests for pages 1..pages, in order.
    public static List<PageRequest> forQuery(String searchBaseUrl, String query, int pages) {
        List<PageRequest> requests = new ArrayList<>(pages);
        for (int page = 1; page <= pages; page++) {
            requests.add(of(searchBaseUrl, query, page));
        }
        return requests;
    }
}
