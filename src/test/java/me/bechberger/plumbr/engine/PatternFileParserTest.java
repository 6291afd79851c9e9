package me.bechberger.plumbr.engine;

import me.bechberger.plumbr.PatternLoadException;
import me.bechberger.plumbr.testutil.TextFileBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PatternFileParserTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesPatternsCommentsAndBlankLines() throws IOException {
        Path file = TextFileBuilder.create()
            .outputTo(tempDir.resolve("custom.txt"))
            .withLine("# my patterns")
            .withLine("")
            .withPattern("order", "order_id", "ORD-\\d{6}", "[ORDER]")
            .withLine("   # indented comment")
            .withPattern("host", "hostname", "[a-z]+\\.corp", "")
            .build();

        PatternFileParser.ParsedFile parsed = PatternFileParser.parse(file);

        assertEquals(2, parsed.patterns().size());
        assertEquals(2, parsed.patternLines());
        assertEquals(0, parsed.malformedLines());

        RedactionPattern order = parsed.patterns().get(0);
        assertEquals("order", order.getName());
        assertEquals("order_id", order.getCategory());
        assertEquals("[ORDER]", order.getReplacement());

        RedactionPattern host = parsed.patterns().get(1);
        assertEquals("[REDACTED:hostname]", host.getReplacement(), "Empty replacement uses the default marker");
    }

    @Test
    void replacementFieldMayBeOmitted() {
        RedactionPattern pattern = PatternFileParser.parseLine("id|ident|ID-[0-9]+", "f.txt", 1);

        assertNotNull(pattern);
        assertEquals("ID-[0-9]+", pattern.getRegex().pattern());
        assertEquals("[REDACTED:ident]", pattern.getReplacement());
    }

    @Test
    void regexMayContainPipes() {
        RedactionPattern pattern = PatternFileParser.parseLine("animal|zoo|cat|dog|bird|<{name}>", "f.txt", 1);

        assertNotNull(pattern);
        assertEquals("cat|dog|bird", pattern.getRegex().pattern());
        assertEquals("<animal>", pattern.getReplacement());
    }

    @Test
    void trailingCarriageReturnIsIgnored() {
        RedactionPattern pattern = PatternFileParser.parseLine("a|b|x+|[X]\r", "f.txt", 1);

        assertNotNull(pattern);
        assertEquals("[X]", pattern.getReplacement());
    }

    @Test
    void malformedLinesAreSkipped() throws IOException {
        Path file = TextFileBuilder.create()
            .outputTo(tempDir.resolve("mixed.txt"))
            .withLine("only_a_name")
            .withLine("two|fields")
            .withLine("|cat|regex|")
            .withLine("name||regex|")
            .withLine("name|cat||")
            .withLine("broken|cat|(unclosed|")
            .withPattern("good", "ok", "good-\\d+", "")
            .build();

        PatternFileParser.ParsedFile parsed = PatternFileParser.parse(file);

        assertThat(parsed.patterns()).extracting(RedactionPattern::getName).containsExactly("good");
        assertEquals(7, parsed.patternLines());
        assertEquals(6, parsed.malformedLines());
    }

    @Test
    void fileWithOnlyMalformedLinesFails() throws IOException {
        Path file = TextFileBuilder.create()
            .outputTo(tempDir.resolve("broken.txt"))
            .withLine("# header")
            .withLine("not a pattern")
            .withLine("bad|cat|[unclosed|")
            .build();

        PatternLoadException e = assertThrows(PatternLoadException.class, () -> PatternFileParser.parse(file));
        assertThat(e.getMessage()).contains("could not be parsed").contains("name|category|regex|replacement");
    }

    @Test
    void fileWithoutPatternsIsEmpty() throws IOException {
        Path file = TextFileBuilder.create()
            .outputTo(tempDir.resolve("comments.txt"))
            .withLines("# nothing", "", "# here")
            .build();

        PatternFileParser.ParsedFile parsed = PatternFileParser.parse(file);

        assertTrue(parsed.patterns().isEmpty());
        assertEquals(0, parsed.patternLines());
    }

    @Test
    void missingFileFails() {
        Path missing = tempDir.resolve("missing.txt");

        PatternLoadException e = assertThrows(PatternLoadException.class, () -> PatternFileParser.parse(missing));
        assertThat(e.getMessage()).contains("not found");
    }

    @Test
    void directoryIsNotAPatternFile() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("dir"));

        assertThrows(PatternLoadException.class, () -> PatternFileParser.parse(dir));
    }
}
