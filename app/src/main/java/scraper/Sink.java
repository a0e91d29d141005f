package scraper;

import java.io.IOException;

// Durable storage for finished query documents.
public interface Sink {

    /**
     * Stores one query's document under {@code destinationId}, replacing what was there.
     *
     * @return number of result records written
     * @throws IOException when the document could not be persisted
     */
    int store(String destinationId, QueryDocument document) throws IOException;
}
