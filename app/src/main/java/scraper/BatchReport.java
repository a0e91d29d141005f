package scraper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Outcome of a batch: how many queries were stored, and which ones failed with what error, in input order.
public record BatchReport(int queries, int stored, int recordsWritten, List<QueryFailure> failedQueries) {

    public BatchReport {
        failedQueries = Collections.unmodifiableList(new ArrayList<>(failedQueries));
    }

    public boolean hasFailures() {
        return !failedQueries.isEmpty();
    }
}
