package scraper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Everything scraped for one query: its pages in index order 1..N.
public record QueryDocument(String query, List<PageResult> pages) {

    public QueryDocument {
        pages = List.copyOf(pages);
    }

    public int totalResults() {
        int total = 0;
        for (PageResult page : pages) total += page.results().size();
        return total;
    }

    // Shape written to disk: {"<query>": [pages...]}
    public Map<String, List<PageResult>> asMap() {
        Map<String, List<PageResult>> map = new LinkedHashMap<>();
        map.put(query, pages);
        return map;
    }
}
