package scraper;

import com.fasterxml.jackson.annotation.JsonProperty;

// One organic search result extracted from a page.
public record ResultRecord(
        String title,
        String link,
        String description,
        @JsonProperty("favicon_path") String faviconPath,
        @JsonProperty("keyword") String query
) { }
