package me.bechberger.plumbr.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Finds the non-overlapping spans to redact in a piece of text.
 * <p>
 * Single left-to-right pass with a "leftmost, then pattern priority" policy:
 * from the current position every pattern is asked for its next match, the match
 * whose replaced span starts first wins and ties go to the pattern registered first.
 * Scanning then resumes at the end of the accepted span.
 * <p>
 * Each pattern's next match is remembered during a scan. It only has to be searched
 * again once the cursor moves past the start of that cached match, so a pattern
 * that never matches is searched exactly once per text.
 * <p>
 * Matchers are created per call; the scanner holds no state and can be used from
 * any number of threads against the same {@link PatternSet}.
 */
public final class Scanner {

    /** Sentinel for "pattern has no further match in this text" */
    private static final int EXHAUSTED = Integer.MAX_VALUE;

    private Scanner() {
        // Utility class
    }

    public static List<Match> scan(CharSequence text, PatternSet patterns) {
        int length = text.length();
        int count = patterns.size();
        if (length == 0 || count == 0) {
            return List.of();
        }

        Matcher[] matchers = new Matcher[count];
        // start of the whole regex match, -1 = not searched yet
        int[] matchStart = new int[count];
        int[] spanStart = new int[count];
        int[] spanEnd = new int[count];
        Arrays.fill(matchStart, -1);

        List<Match> matches = new ArrayList<>();
        int position = 0;
        while (position < length) {
            int best = -1;
            for (int i = 0; i < count; i++) {
                if (matchStart[i] != EXHAUSTED && (matchStart[i] < position || spanStart[i] < position)) {
                    if (matchers[i] == null) {
                        matchers[i] = patterns.get(i).getRegex().matcher(text)
                            .useTransparentBounds(true)
                            .useAnchoringBounds(false);
                    }
                    findNext(matchers[i], patterns.get(i), position, length, i, matchStart, spanStart, spanEnd);
                }
                if (matchStart[i] == EXHAUSTED) {
                    continue;
                }
                if (best < 0 || spanStart[i] < spanStart[best]) {
                    best = i;
                }
            }
            if (best < 0) {
                break;
            }
            matches.add(new Match(best, spanStart[best], spanEnd[best]));
            position = spanEnd[best];
        }
        return matches;
    }

    /**
     * Search the next match of one pattern at or after {@code from} whose replaced span is not empty.
     */
    private static void findNext(Matcher matcher, RedactionPattern pattern, int from, int length, int i,
                                 int[] matchStart, int[] spanStart, int[] spanEnd) {
        int searchFrom = from;
        while (searchFrom < length) {
            matcher.region(searchFrom, length);
            if (!matcher.find()) {
                break;
            }
            int start = matcher.start();
            int end = matcher.end();
            if (pattern.hasSecretGroup() && matcher.start(RedactionPattern.SECRET_GROUP) >= 0) {
                start = matcher.start(RedactionPattern.SECRET_GROUP);
                end = matcher.end(RedactionPattern.SECRET_GROUP);
            }
            if (end > start && start >= from) {
                matchStart[i] = matcher.start();
                spanStart[i] = start;
                spanEnd[i] = end;
                return;
            }
            // empty span or one reaching back before the cursor, retry one char further
            searchFrom = matcher.start() + 1;
        }
        matchStart[i] = EXHAUSTED;
    }
}
