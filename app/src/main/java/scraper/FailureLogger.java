package scraper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;

public class FailureLogger {

    // Keep failures in memory and write them once at the end.
    private final Queue<FailureRecord> failures = new ConcurrentLinkedQueue<>();

    public void add(FailureRecord record) {
        if (record != null) failures.add(record);
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    public int size() {
        return failures.size();
    }

    // How many failures of each type (TIMEOUT, HTTP_STATUS, SAVE_FAILED, ...), sorted by type.
    public Map<String, Integer> countsByType() {
        Map<String, Integer> counts = new TreeMap<>();
        for (FailureRecord record : failures) {
            counts.merge(record.type(), 1, Integer::sum);
        }
        return counts;
    }

    public Collection<FailureRecord> snapshot() {
        return new ArrayList<>(failures);
    }
}
