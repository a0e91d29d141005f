package scraper;

import java.util.concurrent.Semaphore;

/**
 * Counting limiter for one kind of operation (page fetches, queries).
 * A permit is held for the lifetime of a try-with-resources block.
 */
public class ConcurrencyLimiter {

    private final String name;
    private final int limit;
    private final Semaphore semaphore;

    public ConcurrencyLimiter(String name, int limit) {
        if (limit < 1) throw new IllegalArgumentException(name + " limit must be >= 1: " + limit);
        this.name = name;
        this.limit = limit;
        this.semaphore = new Semaphore(limit, true);
    }

    // Blocks the calling thread until a slot is free.
    public Permit acquire() throws InterruptedException {
        semaphore.acquire();
        return new Permit();
    }

    public int limit() {
        return limit;
    }

    public int inUse() {
        return limit - semaphore.availablePermits();
    }

    @Override
    public String toString() {
        return name + " limiter (" + inUse() + "/" + limit + " in use)";
    }

    // Releases its slot exactly once.
    public final class Permit implements AutoCloseable {
        private boolean released;

        private Permit() { }

        @Override
        public void close() {
            if (released) return;
            released = true;
            semaphore.release();
        }
    }
}
