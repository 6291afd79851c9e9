package me.bechberger.plumbr.engine;

import java.io.PrintWriter;
import java.util.Map;

/**
 * Point-in-time copy of an instance's cumulative statistics.
 *
 * @param linesProcessed  lines (or single-text units) seen
 * @param linesModified   lines with at least one substitution
 * @param patternsMatched substitutions performed
 * @param bytesProcessed  UTF-8 size of all input
 * @param elapsedSeconds  wall-clock time spent inside redaction calls
 * @param categoryMatches substitutions per category
 */
public record StatsSnapshot(long linesProcessed, long linesModified, long patternsMatched,
                            long bytesProcessed, double elapsedSeconds, Map<String, Long> categoryMatches) {

    public StatsSnapshot {
        categoryMatches = Map.copyOf(categoryMatches);
    }

    /**
     * Throughput in MB/s, 0 if nothing was processed yet.
     */
    public double megabytesPerSecond() {
        return elapsedSeconds > 0 ? bytesProcessed / (1024.0 * 1024.0) / elapsedSeconds : 0;
    }

    /**
     * Print statistics.
     */
    public void print(PrintWriter out) {
        out.println();
        out.println("=".repeat(70));
        out.println("Redaction Statistics");
        out.println("=".repeat(70));
        out.println();

        out.println("Lines:");
        out.printf("  Lines processed:          %,d%n", linesProcessed);
        out.printf("  Lines modified:           %,d%n", linesModified);
        out.printf("  Bytes processed:          %,d%n", bytesProcessed);
        out.printf("  Elapsed:                  %.3f s (%.1f MB/s)%n", elapsedSeconds, megabytesPerSecond());
        out.println();

        out.println("Redactions:");
        out.printf("  Patterns matched:         %,d%n", patternsMatched);
        out.println();

        if (!categoryMatches.isEmpty()) {
            out.println("Redaction categories:");
            categoryMatches.entrySet().stream()
                .sorted((a, b) -> Long.compare(b.getValue(), a.getValue()))
                .forEach(entry -> out.printf("  %-30s %,d%n", entry.getKey(), entry.getValue()));
            out.println();
        }

        out.println("=".repeat(70));
        out.flush();
    }
}
