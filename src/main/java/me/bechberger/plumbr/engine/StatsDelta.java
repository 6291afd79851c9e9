package me.bechberger.plumbr.engine;

import java.util.HashMap;
import java.util.Map;

/**
 * Counters collected by one worker for one call, folded into {@link RedactionStats} afterwards.
 * Not thread-safe, each worker owns its delta.
 */
final class StatsDelta {

    long lines;
    long linesModified;
    long patternsMatched;
    long bytes;
    final Map<String, Long> categoryMatches = new HashMap<>();

    void record(RedactionResult result, long lineBytes, PatternSet patterns) {
        lines++;
        bytes += lineBytes;
        if (result.isModified()) {
            linesModified++;
            patternsMatched += result.matchCount();
            for (Match match : result.matches()) {
                categoryMatches.merge(patterns.get(match.patternIndex()).getCategory(), 1L, Long::sum);
            }
        }
    }

    void add(StatsDelta other) {
        lines += other.lines;
        linesModified += other.linesModified;
        patternsMatched += other.patternsMatched;
        bytes += other.bytes;
        other.categoryMatches.forEach((category, count) -> categoryMatches.merge(category, count, Long::sum));
    }
}
