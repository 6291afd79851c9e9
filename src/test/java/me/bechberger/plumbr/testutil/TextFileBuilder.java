package me.bechberger.plumbr.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for test text files: log files to redact and custom pattern files.
 * Lines are separated by {@code \n} regardless of platform.
 */
public class TextFileBuilder {

    private final List<String> lines = new ArrayList<>();
    private Path outputPath;
    private boolean trailingNewline = true;

    public static TextFileBuilder create() {
        return new TextFileBuilder();
    }

    public TextFileBuilder outputTo(Path path) {
        this.outputPath = path;
        return this;
    }

    public TextFileBuilder withLine(String line) {
        lines.add(line);
        return this;
    }

    public TextFileBuilder withLines(String... lines) {
        this.lines.addAll(Arrays.asList(lines));
        return this;
    }

    /**
     * Add a custom pattern line {@code name|category|regex|replacement}.
     */
    public TextFileBuilder withPattern(String name, String category, String regex, String replacement) {
        lines.add(name + "|" + category + "|" + regex + "|" + replacement);
        return this;
    }

    /**
     * Leave out the newline after the last line.
     */
    public TextFileBuilder withoutTrailingNewline() {
        this.trailingNewline = false;
        return this;
    }

    public String content() {
        String joined = String.join("\n", lines);
        return trailingNewline && !lines.isEmpty() ? joined + "\n" : joined;
    }

    /**
     * Build and write the file
     */
    public Path build() throws IOException {
        if (outputPath == null) {
            outputPath = Files.createTempFile("test-text-", ".txt");
        }
        Files.writeString(outputPath, content(), StandardCharsets.UTF_8);
        return outputPath;
    }
}
