package me.bechberger.plumbr.engine;

import me.bechberger.plumbr.PatternLoadException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Parser for custom pattern files.
 * <p>
 * One pattern per line, four fields separated by {@code |}:
 * <pre>
 * # comment
 * name|category|regex|replacement
 * </pre>
 * The replacement may be empty or left out, it then defaults to
 * {@link RedactionPattern#DEFAULT_REPLACEMENT}. A regex that contains {@code |} itself
 * is supported: the first two fields are name and category, the last field of a line
 * with more than four fields is the replacement and everything in between is the regex.
 * <p>
 * Malformed lines are skipped with a warning that names the file (base name only)
 * and the line number.
 */
public final class PatternFileParser {

    private static final Logger logger = LoggerFactory.getLogger(PatternFileParser.class);

    private PatternFileParser() {
        // Utility class
    }

    /**
     * Result of parsing one file.
     *
     * @param patterns       compiled patterns in file order
     * @param patternLines   number of non-comment, non-blank lines
     * @param malformedLines number of those lines that were skipped
     */
    public record ParsedFile(List<RedactionPattern> patterns, int patternLines, int malformedLines) {
    }

    /**
     * Parse a pattern file.
     *
     * @throws PatternLoadException if the file is missing, unreadable, not UTF-8, or every
     *                              pattern line in it is malformed
     */
    public static ParsedFile parse(Path file) throws PatternLoadException {
        String fileName = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        if (!Files.exists(file)) {
            throw new PatternLoadException(
                "Pattern file not found: " + file.toAbsolutePath() + "\n" +
                "Please check the file path and ensure the file exists.");
        }
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new PatternLoadException(
                "Pattern file is not a readable file: " + file.toAbsolutePath() + "\n" +
                "Please check file permissions.");
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            throw new PatternLoadException("Pattern file is not valid UTF-8: " + file.toAbsolutePath(), e);
        } catch (IOException e) {
            throw new PatternLoadException(
                "Failed to read pattern file: " + file.toAbsolutePath() + "\n" +
                "Error: " + e.getMessage(), e);
        }

        List<RedactionPattern> patterns = new ArrayList<>();
        int patternLines = 0;
        int malformed = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = stripLineEnd(lines.get(i));
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            patternLines++;
            RedactionPattern pattern = parseLine(line, fileName, i + 1);
            if (pattern == null) {
                malformed++;
            } else {
                patterns.add(pattern);
            }
        }

        if (patternLines == 0) {
            logger.warn("{}: no patterns defined", fileName);
        } else if (patterns.isEmpty()) {
            throw new PatternLoadException(
                "Pattern file could not be parsed: " + file.toAbsolutePath() + "\n" +
                "All " + patternLines + " pattern line(s) are malformed.\n" +
                "Expected format: name|category|regex|replacement");
        }
        logger.debug("Loaded {} pattern(s) from {} ({} malformed line(s) skipped)",
            patterns.size(), fileName, malformed);
        return new ParsedFile(patterns, patternLines, malformed);
    }

    /**
     * Parse a single pattern line.
     *
     * @param fileName   base name of the file, for warnings
     * @param lineNumber 1-based line number, for warnings
     * @return the compiled pattern or {@code null} if the line is malformed
     */
    @Nullable
    public static RedactionPattern parseLine(String line, String fileName, int lineNumber) {
        String[] fields = stripLineEnd(line).split("\\|", -1);
        if (fields.length < 3) {
            logger.warn("{}:{}: Invalid format (expected name|category|regex|replacement)", fileName, lineNumber);
            return null;
        }
        String name = fields[0].strip();
        String category = fields[1].strip();
        String regex;
        String replacement;
        if (fields.length == 3) {
            regex = fields[2];
            replacement = "";
        } else {
            regex = String.join("|", Arrays.asList(fields).subList(2, fields.length - 1));
            replacement = fields[fields.length - 1].strip();
        }

        if (name.isEmpty() || category.isEmpty() || regex.isEmpty()) {
            logger.warn("{}:{}: Invalid format (name, category and regex must not be empty)", fileName, lineNumber);
            return null;
        }
        try {
            return RedactionPattern.compile(name, category, regex, replacement);
        } catch (PatternSyntaxException e) {
            logger.warn("{}:{}: Failed to compile pattern '{}': {}", fileName, lineNumber, name, e.getDescription());
            return null;
        }
    }

    private static String stripLineEnd(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) {
            end--;
        }
        return line.substring(0, end);
    }
}
