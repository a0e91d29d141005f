package scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @Test
    void safeNameKeepsLettersDigitsAndUnderscores() {
        assertEquals("best_cat_food_2024", UrlUtil.toSafeName("best cat food 2024"));
        assertEquals("whats_new", UrlUtil.toSafeName("what's new?"));
        assertEquals("snake_case_query", UrlUtil.toSafeName("snake_case_query"));
        assertEquals("café_über", UrlUtil.toSafeName("café über!"));
    }

    @Test
    void safeNameIsStableAcrossCalls() {
        String query = "cheap flights: paris -> rome";
        assertEquals(UrlUtil.toSafeName(query), UrlUtil.toSafeName(new String(query)));
    }

    @Test
    void safeNamesDifferWhenLettersDiffer() {
        assertNotEquals(UrlUtil.toSafeName("new-york hotels"), UrlUtil.toSafeName("new york hotels"));
        assertNotEquals(UrlUtil.toSafeName("rock & roll!"), UrlUtil.toSafeName("rock n roll!"));
        // Only punctuation differs: same name, same file
        assertEquals(UrlUtil.toSafeName("c++ tutorial"), UrlUtil.toSafeName("c# tutorial!"));
    }

    @Test
    void safeNameIsShortenedWithHashWhenTooLong() {
        String longQuery = "a".repeat(200);
        String name = UrlUtil.toSafeName(longQuery);

        assertTrue(name.length() < 200);
        assertTrue(name.contains("__"));
        assertNotEquals(name, UrlUtil.toSafeName("a".repeat(201)));
    }

    @Test
    void safeNameNeverEmpty() {
        String name = UrlUtil.toSafeName("?!?");
        assertTrue(name.startsWith("query__"));
        assertEquals(name, UrlUtil.toSafeName("?!?"));
        assertNotEquals(name, UrlUtil.toSafeName("..."));
    }

    @Test
    void searchUrlAddsOffsetFromSecondPage() {
        String base = "https://www.ecosia.org/search";
        assertEquals("https://www.ecosia.org/search?q=cat%20food", UrlUtil.searchUrl(base, "cat food", 1));
        assertEquals("https://www.ecosia.org/search?q=cat%20food&p=1", UrlUtil.searchUrl(base, "cat food", 2));
        assertEquals("https://www.ecosia.org/search?q=a%26b&p=4", UrlUtil.searchUrl(base, "a&b", 5));
        assertThrows(IllegalArgumentException.class, () -> UrlUtil.searchUrl(base, "x", 0));
    }

    @Test
    void pageRequestsCoverEveryPageInOrder() {
        List<PageRequest> requests = PageRequest.forQuery("https://s.example/search", "dogs", 3);

        assertEquals(3, requests.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i + 1, requests.get(i).pageIndex());
            assertEquals("dogs", requests.get(i).query());
        }
        assertFalse(requests.get(0).url().contains("&p="));
        assertTrue(requests.get(2).url().endsWith("&p=2"));
    }

    @Test
    void faviconUsesLinkAuthority() {
        assertEquals("https://www.google.com/s2/favicons?domain=example.com",
                UrlUtil.faviconFor("https://example.com/a/b?c=d"));
        assertEquals("https://www.google.com/s2/favicons?domain=example.com:8080",
                UrlUtil.faviconFor("http://example.com:8080#top"));
    }

    @Test
    void outputManagerOverwritesSameQuery(@TempDir Path tempDir) throws Exception {
        OutputManager outputManager = new OutputManager(tempDir, new FailureLogger());
        ResultRecord record = new ResultRecord("T", "https://example.com", "", UrlUtil.faviconFor("https://example.com"), "cats");

        outputManager.store("cats", new QueryDocument("cats", List.of(new PageResult(1, List.of(record)))));
        int written = outputManager.store("cats", new QueryDocument("cats", List.of(PageResult.empty(1))));

        assertEquals(0, written);
        try (Stream<Path> paths = Files.list(tempDir)) {
            assertEquals(1L, paths.count());
        }
        JsonNode root = new ObjectMapper().readTree(tempDir.resolve("cats.json").toFile());
        assertEquals(0, root.get("cats").get(0).get("results").size());
    }

    @Test
    void outputManagerWritesDocumentShapeKeepingNonAsciiText(@TempDir Path tempDir) throws Exception {
        OutputManager outputManager = new OutputManager(tempDir, new FailureLogger());
        ResultRecord record = new ResultRecord("Chats & chiens – guide", "https://exemple.fr/chats",
                "Tout sur les chats", UrlUtil.faviconFor("https://exemple.fr/chats"), "chats été");
        QueryDocument document = new QueryDocument("chats été",
                List.of(new PageResult(1, List.of(record)), PageResult.empty(2)));

        int written = outputManager.store(UrlUtil.toSafeName("chats été"), document);

        assertEquals(1, written);
        Path file = tempDir.resolve("chats_été.json");
        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.contains("Chats & chiens – guide"));
        assertTrue(json.contains("chats été"));

        JsonNode root = new ObjectMapper().readTree(json);
        JsonNode pages = root.get("chats été");
        assertEquals(2, pages.size());
        assertEquals(1, pages.get(0).get("page").asInt());
        JsonNode first = pages.get(0).get("results").get(0);
        assertEquals("https://exemple.fr/chats", first.get("link").asText());
        assertEquals("https://www.google.com/s2/favicons?domain=exemple.fr", first.get("favicon_path").asText());
        assertEquals("chats été", first.get("keyword").asText());
        assertEquals(2, pages.get(1).get("page").asInt());
        assertEquals(0, pages.get(1).get("results").size());
    }

    @Test
    void failuresFileListsEveryFailure(@TempDir Path tempDir) throws Exception {
        FailureLogger failureLogger = new FailureLogger();
        OutputManager outputManager = new OutputManager(tempDir, failureLogger);

        outputManager.writeFailuresFile();
        assertFalse(Files.exists(outputManager.failuresFile()));

        failureLogger.add(new FailureRecord("cats", 2, "https://s.example/search?q=cats&p=1", "TIMEOUT", "Read timed out"));
        failureLogger.add(new FailureRecord("say \"hi\"", 0, "say_hi", "SAVE_FAILED", "disk full"));
        outputManager.writeFailuresFile();

        List<String> lines = Files.readAllLines(outputManager.failuresFile(), StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("query,page,url,type,message", lines.get(0));
        assertTrue(lines.get(1).contains("\"TIMEOUT\""));
        assertTrue(lines.get(2).startsWith("\"say \"\"hi\"\"\""));
    }
}
