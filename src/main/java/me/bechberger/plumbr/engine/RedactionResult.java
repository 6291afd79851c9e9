package me.bechberger.plumbr.engine;

import java.util.List;

/**
 * Output of redacting one unit of text.
 *
 * @param text    the rewritten text, the input instance itself when nothing matched
 * @param matches the substituted spans, in input coordinates
 */
public record RedactionResult(String text, List<Match> matches) {

    public static RedactionResult unchanged(String text) {
        return new RedactionResult(text, List.of());
    }

    public int matchCount() {
        return matches.size();
    }

    public boolean isModified() {
        return !matches.isEmpty();
    }
}
