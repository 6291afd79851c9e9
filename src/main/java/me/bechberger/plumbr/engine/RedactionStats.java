package me.bechberger.plumbr.engine;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative statistics of one instance.
 * <p>
 * Updated concurrently by every call on the instance; counters only ever grow.
 */
public class RedactionStats {

    private final AtomicLong linesProcessed = new AtomicLong(0);
    private final AtomicLong linesModified = new AtomicLong(0);
    private final AtomicLong patternsMatched = new AtomicLong(0);
    private final AtomicLong bytesProcessed = new AtomicLong(0);
    private final AtomicLong elapsedNanos = new AtomicLong(0);
    private final Map<String, AtomicLong> categoryMatches = new ConcurrentHashMap<>();

    /**
     * Fold the counters of one finished call (or worker) into the totals.
     */
    void record(StatsDelta delta) {
        // modified and matched are published before processed, so a concurrent
        // snapshot (which reads in the opposite order) never sees modified > processed
        delta.categoryMatches.forEach((category, count) ->
            categoryMatches.computeIfAbsent(category, k -> new AtomicLong(0)).addAndGet(count));
        patternsMatched.addAndGet(delta.patternsMatched);
        linesModified.addAndGet(delta.linesModified);
        bytesProcessed.addAndGet(delta.bytes);
        linesProcessed.addAndGet(delta.lines);
    }

    /**
     * Add wall-clock time spent in a redaction call. Every call counts at least one nanosecond.
     */
    public void recordElapsed(long nanos) {
        elapsedNanos.addAndGet(Math.max(1, nanos));
    }

    public long getLinesProcessed() {
        return linesProcessed.get();
    }

    public long getLinesModified() {
        return linesModified.get();
    }

    public long getPatternsMatched() {
        return patternsMatched.get();
    }

    public long getBytesProcessed() {
        return bytesProcessed.get();
    }

    public long getElapsedNanos() {
        return elapsedNanos.get();
    }

    public double getElapsedSeconds() {
        return elapsedNanos.get() / 1_000_000_000.0;
    }

    public Map<String, AtomicLong> getCategoryMatches() {
        return categoryMatches;
    }

    public StatsSnapshot snapshot() {
        double elapsed = getElapsedSeconds();
        long processed = linesProcessed.get();
        long bytes = bytesProcessed.get();
        long modified = linesModified.get();
        long matched = patternsMatched.get();
        Map<String, Long> categories = new HashMap<>();
        categoryMatches.forEach((category, count) -> categories.put(category, count.get()));
        // processed was read first, re-read it so it covers everything counted in modified
        processed = Math.max(processed, linesProcessed.get());
        return new StatsSnapshot(processed, modified, matched, bytes, elapsed, categories);
    }

    /**
     * Print statistics to stdout.
     */
    public void print() {
        print(new PrintWriter(System.out, true));
    }

    public void print(PrintStream out) {
        print(new PrintWriter(out, true));
    }

    public void print(PrintWriter out) {
        snapshot().print(out);
    }

    @Override
    public String toString() {
        return String.format("%d lines processed, %d modified, %d patterns matched, %d bytes in %.3f s",
            linesProcessed.get(), linesModified.get(), patternsMatched.get(), bytesProcessed.get(),
            getElapsedSeconds());
    }
}
