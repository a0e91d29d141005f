package scraper;

// Where QueryScraper gets page content from.
@FunctionalInterface
public interface PageSource {

    FetchOutcome fetch(String url);
}
