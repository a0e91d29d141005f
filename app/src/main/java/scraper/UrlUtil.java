package scraper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

public class UrlUtil {

    private static final String FAVICON_SERVICE = "https://www.google.com/s2/favicons?domain=";

    // Search URL for one page: page 1 is the bare search, page n adds p=n-1.
    public static String searchUrl(String searchBaseUrl, String query, int pageIndex) {
        if (pageIndex < 1) throw new IllegalArgumentException("page index must be >= 1: " + pageIndex);
        String url = searchBaseUrl + "?q=" + escapeQuery(query);
        return pageIndex == 1 ? url : url + "&p=" + (pageIndex - 1);
    }

    // Percent-escape a query value; spaces become %20 rather than '+'.
    public static String escapeQuery(String query) {
        return URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
    }

    // Create a stable, filesystem-safe name for a query.
    // Keeps letters, digits, spaces and underscores, then turns spaces into underscores.
    // Only adds a hash when the name is too long or nothing survives.
    public static String toSafeName(String query) {
        StringBuilder sb = new StringBuilder(query.length());
        query.codePoints()
                .filter(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '_')
                .forEach(sb::appendCodePoint);
        String safe = sb.toString().replace(' ', '_');

        // Keep <outputDir>/<name>.json safely under Windows limits.
        int maxBase = 160;
        if (safe.length() > maxBase) {
            return safe.substring(0, maxBase) + "__" + shortHash(query);
        }
        if (safe.isEmpty()) {
            return "query__" + shortHash(query);
        }
        return safe;
    }

    // Short hash for names to avoid collisions.
    private static String shortHash(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            // 12 hex chars is plenty for collisions to be extremely unlikely here
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 6; i++) sb.append(String.format("%02x", digest[i]));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // Only accept http/https links.
    public static boolean isHttpLike(String url) {
        if (url == null) return false;
        String u = url.toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }

    // Authority part of an absolute URL (host plus optional port), without parsing the rest.
    // Result links are not always valid URIs, so this never throws.
    public static String authorityOf(String url) {
        int start = url.indexOf("://");
        if (start < 0) return "";
        start += 3;
        int end = start;
        while (end < url.length()) {
            char c = url.charAt(end);
            if (c == '/' || c == '?' || c == '#') break;
            end++;
        }
        return url.substring(start, end);
    }

    public static String faviconFor(String link) {
        return FAVICON_SERVICE + authorityOf(link);
    }
}
