package scraper;

/**
 * Turns the raw markup of one result page into result records.
 * <p>
 * Implementations never throw: a {@code null} page (fetch failed) and anything
 * unrecognizable both yield a {@link PageResult} for {@code pageIndex}, possibly empty.
 */
public interface PageParser {

    PageResult parse(String html, String query, int pageIndex);
}
