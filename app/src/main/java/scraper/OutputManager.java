package scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;

// Writes one JSON file per query plus failures.csv, all under the output directory.
public class OutputManager implements Sink {

    private static final Logger log = LoggerFactory.getLogger(OutputManager.class);

    private final Path outputDir;

    private final FailureLogger failureLogger;

    // Pretty-printed; Jackson keeps non-ASCII text as is
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public OutputManager(Path outputDir, FailureLogger failureLogger) {
        this.outputDir = outputDir;
        this.failureLogger = failureLogger;
    }

    public Path fileFor(String destinationId) {
        return outputDir.resolve(destinationId + ".json");
    }

    @Override
    public int store(String destinationId, QueryDocument document) throws IOException {
        Files.createDirectories(outputDir);
        Path out = fileFor(destinationId);

        // Each call writes its own temp file; the target is only ever replaced by a complete one
        Path tmp = Files.createTempFile(outputDir, destinationId + ".", ".json.tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                mapper.writeValue(writer, document.asMap());
            }
            moveIntoPlace(tmp, out);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }

        int written = document.totalResults();
        log.info("Saved {} with {} results", out.getFileName(), written);
        return written;
    }

    // Last writer wins when two queries share a destination id.
    private static void moveIntoPlace(Path tmp, Path out) throws IOException {
        try {
            Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to a plain replace", out);
            Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public Path failuresFile() {
        return outputDir.resolve("failures.csv");
    }

    public void writeFailuresFile() {
        if (failureLogger.isEmpty()) return;

        Path out = failuresFile();
        try {
            Files.createDirectories(outputDir);

            // Very simple CSV: query,page,url,type,message
            List<String> lines = new ArrayList<>();
            lines.add("query,page,url,type,message");

            for (FailureRecord f : failureLogger.snapshot()) {
                lines.add(csv(f.query()) + "," + csv(f.page()) + "," + csv(f.url()) + ","
                        + csv(f.type()) + "," + csv(f.message()));
            }

            Files.write(out, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);

            log.info("Wrote failures file: {}", out);
        } catch (IOException e) {
            log.error("Could not write failures file {}: {}", out, e.getMessage());
        }
    }

    // Quote CSV fields safely (minimal)
    private static String csv(Object v) {
        String s = v == null ? "" : String.valueOf(v);
        s = s.replace("\"", "\"\"");
        return "\"" + s + "\"";
    }
}
