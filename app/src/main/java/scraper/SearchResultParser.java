package scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Extracts organic results from a search result page with Jsoup.
 * <p>
 * Every {@code div} not marked as an ad or cookie notice is a candidate. A candidate
 * becomes a record only if it carries no sponsorship marker and its first link is
 * absolute. Records keep document order.
 */
public class SearchResultParser implements PageParser {

    private static final Logger log = LoggerFactory.getLogger(SearchResultParser.class);

    public static final String NO_TITLE = "No title";

    public static final List<String> DEFAULT_SPONSOR_MARKERS = List.of("provided by google", "sponsored");

    private static final String CANDIDATES = "div:not([class*=ad]):not([class*=cookie])";

    private static final List<String> DESCRIPTION_CLASS_HINTS = List.of("description", "snippet", "result");

    // Lower-case markers matched against lower-cased element text
    private final List<String> sponsorMarkers;

    public SearchResultParser() {
        this(DEFAULT_SPONSOR_MARKERS);
    }

    public SearchResultParser(List<String> sponsorMarkers) {
        List<String> lowered = new ArrayList<>(sponsorMarkers.size());
        for (String marker : sponsorMarkers) lowered.add(marker.toLowerCase(Locale.ROOT));
        this.sponsorMarkers = List.copyOf(lowered);
    }

    @Override
    public PageResult parse(String html, String query, int pageIndex) {
        if (html == null) {
            log.debug("No HTML for page {} of query {}", pageIndex, query);
            return PageResult.empty(pageIndex);
        }

        Document doc = Jsoup.parse(html);
        List<ResultRecord> results = new ArrayList<>();

        for (Element candidate : doc.select(CANDIDATES)) {
            String text = candidate.text();
            if (isSponsored(text)) {
                log.debug("Skipped sponsored result: {}...", preview(text));
                continue;
            }

            Element linkTag = candidate.selectFirst("a[href]");
            String link = linkTag == null ? null : linkTag.attr("href").strip();
            if (!UrlUtil.isHttpLike(link)) {
                log.debug("No valid link in result: {}...", preview(text));
                continue;
            }

            String title = linkTag.text().strip();
            if (title.isEmpty()) title = NO_TITLE;

            results.add(new ResultRecord(title, link, descriptionOf(candidate), UrlUtil.faviconFor(link), query));
            log.debug("Parsed result: {}... | Link: {}...", preview(title), preview(link));
        }

        log.info("Extracted {} results for page {} of query {}", results.size(), pageIndex, query);
        return new PageResult(pageIndex, results);
    }

    private boolean isSponsored(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : sponsorMarkers) {
            if (lower.contains(marker)) return true;
        }
        return false;
    }

    // Text of the first nested div that looks like a snippet, or "".
    private static String descriptionOf(Element candidate) {
        for (Element div : candidate.getElementsByTag("div")) {
            if (div == candidate) continue;
            String cls = div.className().toLowerCase(Locale.ROOT);
            if (cls.isEmpty()) continue;
            for (String hint : DESCRIPTION_CLASS_HINTS) {
                if (cls.contains(hint)) return div.text().strip();
            }
        }
        return "";
    }

    private static String preview(String s) {
        return s.length() <= 50 ? s : s.substring(0, 50);
    }
}
