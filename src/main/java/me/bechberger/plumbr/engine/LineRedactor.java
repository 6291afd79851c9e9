package me.bechberger.plumbr.engine;

import java.util.List;

/**
 * Rewrites text by substituting scanner matches with their pattern's marker.
 * <p>
 * Stateless apart from the immutable pattern set, safe for concurrent use.
 */
public class LineRedactor {

    private final PatternSet patterns;

    public LineRedactor(PatternSet patterns) {
        this.patterns = patterns;
    }

    public PatternSet getPatterns() {
        return patterns;
    }

    /**
     * Scan and rewrite a line (or any other unit of text).
     */
    public RedactionResult redact(String text) {
        if (text.isEmpty()) {
            return RedactionResult.unchanged(text);
        }
        return apply(text, Scanner.scan(text, patterns));
    }

    /**
     * Copy unmatched spans verbatim and replace each match with its marker.
     *
     * @param text    the scanned text
     * @param matches ordered, non-overlapping matches as produced by {@link Scanner#scan}
     */
    public RedactionResult apply(String text, List<Match> matches) {
        if (matches.isEmpty()) {
            return RedactionResult.unchanged(text);
        }
        StringBuilder out = new StringBuilder(text.length() + matches.size() * 16);
        int copied = 0;
        for (Match match : matches) {
            out.append(text, copied, match.start());
            out.append(patterns.get(match.patternIndex()).getReplacement());
            copied = match.end();
        }
        out.append(text, copied, text.length());
        return new RedactionResult(out.toString(), matches);
    }
}
