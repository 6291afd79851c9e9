package me.bechberger.plumbr.engine;

/**
 * A span of text claimed by one pattern.
 *
 * @param patternIndex index of the pattern in its {@link PatternSet}
 * @param start        first replaced char (inclusive)
 * @param end          last replaced char (exclusive)
 */
public record Match(int patternIndex, int start, int end) {

    public int length() {
        return end - start;
    }
}
