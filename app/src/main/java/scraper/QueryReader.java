package scraper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// Reads queries from a ';'-separated CSV file: first column only, blank rows skipped.
public class QueryReader {

    private final char delimiter;

    public QueryReader() {
        this(';');
    }

    public QueryReader(char delimiter) {
        this.delimiter = delimiter;
    }

    public List<String> read(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public List<String> parse(List<String> lines) {
        List<String> queries = new ArrayList<>();
        for (String line : lines) {
            if (line.isEmpty()) continue;
            // Excel likes to start UTF-8 files with a BOM
            if (queries.isEmpty() && line.charAt(0) == '\uFEFF') line = line.substring(1);
            if (line.isBlank()) continue;

            String query = firstField(line);
            if (!query.isBlank()) queries.add(query);
        }
        return queries;
    }

    // First field of a row, unquoting "..." and "" escapes.
    String firstField(String line) {
        if (!line.startsWith("\"")) {
            int cut = line.indexOf(delimiter);
            return cut < 0 ? line : line.substring(0, cut);
        }

        StringBuilder sb = new StringBuilder();
        int i = 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '"') {
                if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    sb.append('"');
                    i += 2;
                    continue;
                }
                break; // closing quote
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }
}
