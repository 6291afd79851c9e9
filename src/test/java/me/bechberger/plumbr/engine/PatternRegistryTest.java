package me.bechberger.plumbr.engine;

import me.bechberger.plumbr.PatternLoadException;
import me.bechberger.plumbr.config.RedactorConfig;
import me.bechberger.plumbr.testutil.TextFileBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternRegistryTest {

    @TempDir
    Path tempDir;

    private static RedactorConfig config() {
        return new RedactorConfig();
    }

    @Test
    void defaultsAreTheBuiltinTable() throws PatternLoadException {
        PatternSet patterns = PatternRegistry.build(config());

        assertThat(patterns.size()).isPositive();
        assertThat(patterns.size()).isEqualTo(PatternRegistry.builtinDefinitions().size());
        assertThat(patterns.categories()).hasSize(patterns.size());
        assertThat(patterns.names()).contains("aws_access_key", "github_token", "jwt", "password", "email",
            "credit_card", "ipv4", "private_key");
    }

    @Test
    void complianceProfileSelectsItsCategories() throws PatternLoadException {
        RedactorConfig config = config();
        config.setCompliance(Set.of("hipaa"));

        assertThat(PatternRegistry.build(config).names()).containsExactly("email", "ssn", "ipv4", "phone");
    }

    @Test
    void profilesAreUnited() throws PatternLoadException {
        RedactorConfig config = config();
        config.setCompliance(Set.of("hipaa", "pci"));

        PatternSet patterns = PatternRegistry.build(config);

        assertThat(patterns.names()).contains("email", "ssn", "credit_card", "iban", "password");
        assertThat(patterns.names()).doesNotContain("jwt", "github_token");
    }

    @Test
    void allProfileSelectsEverything() throws PatternLoadException {
        RedactorConfig config = config();
        config.setCompliance(Set.of("ALL"));

        assertThat(PatternRegistry.build(config).size()).isEqualTo(PatternRegistry.builtin().size());
    }

    @Test
    void unknownProfileFails() {
        RedactorConfig config = config();
        config.setCompliance(Set.of("iso27001"));

        assertThatThrownBy(() -> PatternRegistry.build(config))
            .isInstanceOf(PatternLoadException.class)
            .hasMessageContaining("iso27001")
            .hasMessageContaining("hipaa");
    }

    @Test
    void customPatternOverridesBuiltinInPlace() throws IOException {
        int emailIndex = PatternRegistry.builtin().names().stream().toList().indexOf("email");
        Path file = TextFileBuilder.create()
            .outputTo(tempDir.resolve("custom.txt"))
            .withPattern("email", "contact", "[a-z]+@corp\\.example", "")
            .build();
        RedactorConfig config = config();
        config.setPatternFile(file.toString());

        PatternSet patterns = PatternRegistry.build(config);

        assertThat(patterns.size()).isEqualTo(PatternRegistry.builtin().size());
        assertThat(patterns.get(emailIndex).getName()).isEqualTo("email");
        assertThat(patterns.get(emailIndex).getCategory()).isEqualTo("contact");
    }

    @Test
    void customPatternsAreAppended() throws IOException {
        Path file = TextFileBuilder.create()
            .outputTo(tempDir.resolve("custom.txt"))
            .withPattern("order", "order", "\\bORD-\\d{6}\\b", "")
            .withPattern("ticket", "ticket", "\\bTCK-\\d+\\b", "")
            .build();
        RedactorConfig config = config();
        config.setPatternFile(file.toString());

        PatternSet patterns = PatternRegistry.build(config);

        int builtins = PatternRegistry.builtin().size();
        assertThat(patterns.size()).isEqualTo(builtins + 2);
        assertThat(patterns.get(builtins).getName()).isEqualTo("order");
        assertThat(patterns.get(builtins + 1).getName()).isEqualTo("ticket");
    }

    @Test
    void directoryFilesAreMergedInLexicographicOrder() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("patterns.d"));
        TextFileBuilder.create().outputTo(dir.resolve("b.txt"))
            .withPattern("shared", "from_b", "\\bSHARED\\b", "").build();
        TextFileBuilder.create().outputTo(dir.resolve("a.txt"))
            .withPattern("shared", "from_a", "\\bSHARED\\b", "")
            .withPattern("only_a", "a", "\\bAAA\\b", "").build();
        TextFileBuilder.create().outputTo(dir.resolve(".hidden"))
            .withPattern("hidden", "hidden", "\\bHIDDEN\\b", "").build();
        Files.createDirectory(dir.resolve("subdir"));

        RedactorConfig config = config();
        config.setPatternDir(dir.toString());
        PatternSet patterns = PatternRegistry.build(config);

        assertThat(patterns.get("shared").getCategory()).isEqualTo("from_b");
        assertThat(patterns.contains("only_a")).isTrue();
        assertThat(patterns.contains("hidden")).isFalse();
    }

    @Test
    void directoryIsMergedAfterPatternFile() throws IOException {
        Path file = TextFileBuilder.create().outputTo(tempDir.resolve("file.txt"))
            .withPattern("shared", "from_file", "\\bSHARED\\b", "").build();
        Path dir = Files.createDirectory(tempDir.resolve("dir"));
        TextFileBuilder.create().outputTo(dir.resolve("x.txt"))
            .withPattern("shared", "from_dir", "\\bSHARED\\b", "").build();

        RedactorConfig config = config();
        config.setPatternFile(file.toString());
        config.setPatternDir(dir.toString());

        assertThat(PatternRegistry.build(config).get("shared").getCategory()).isEqualTo("from_dir");
    }

    @Test
    void customPatternsApplyOnTopOfComplianceSelection() throws IOException {
        Path file = TextFileBuilder.create().outputTo(tempDir.resolve("custom.txt"))
            .withPattern("order", "order", "\\bORD-\\d{6}\\b", "").build();
        RedactorConfig config = config();
        config.setCompliance(Set.of("hipaa"));
        config.setPatternFile(file.toString());

        assertThat(PatternRegistry.build(config).names()).containsExactly("email", "ssn", "ipv4", "phone", "order");
    }

    @Test
    void customFileAddsAtMostItsLineCount() throws IOException {
        Path file = TextFileBuilder.create().outputTo(tempDir.resolve("custom.txt"))
            .withPattern("one", "one", "\\bONE\\b", "")
            .withLine("malformed line")
            .withPattern("two", "two", "\\bTWO\\b", "")
            .build();
        RedactorConfig config = config();
        config.setPatternFile(file.toString());

        int added = PatternRegistry.build(config).size() - PatternRegistry.builtin().size();
        assertThat(added).isBetween(0, 3).isEqualTo(2);
    }

    @Test
    void missingPatternFileFails() {
        RedactorConfig config = config();
        config.setPatternFile(tempDir.resolve("nope.txt").toString());

        assertThatThrownBy(() -> PatternRegistry.build(config))
            .isInstanceOf(PatternLoadException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void missingPatternDirectoryFails() {
        RedactorConfig config = config();
        config.setPatternDir(tempDir.resolve("nope.d").toString());

        assertThatThrownBy(() -> PatternRegistry.build(config))
            .isInstanceOf(PatternLoadException.class)
            .hasMessageContaining("Pattern directory not found");
    }

    @Test
    void patternDirThatIsAFileFails() throws IOException {
        Path file = Files.writeString(tempDir.resolve("file.txt"), "a|b|c|\n");
        RedactorConfig config = config();
        config.setPatternDir(file.toString());

        assertThatThrownBy(() -> PatternRegistry.build(config)).isInstanceOf(PatternLoadException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        // regex matches the default markers of other patterns
        "greedy|misc|REDACTED|",
        // marker would be redacted by the built-in email pattern
        "mailer|misc|\\bMAILER\\b|admin@example.com",
        // marker would be redacted by the pattern itself
        "selfish|misc|X+|XXX"
    })
    void patternWithUnstableMarkerIsSkipped(String line) throws IOException {
        Path file = TextFileBuilder.create().outputTo(tempDir.resolve("custom.txt"))
            .withLine(line)
            .withPattern("fine", "fine", "\\bFINE\\b", "")
            .build();
        RedactorConfig config = config();
        config.setPatternFile(file.toString());

        PatternSet patterns = PatternRegistry.build(config);

        assertThat(patterns.size()).isEqualTo(PatternRegistry.builtin().size() + 1);
        assertThat(patterns.contains("fine")).isTrue();
    }

    @Test
    void builtinMarkersAreNeverMatched() {
        PatternSet builtin = PatternRegistry.builtin();
        for (RedactionPattern pattern : builtin) {
            assertThat(Scanner.scan(pattern.getReplacement(), builtin))
                .as("marker of %s", pattern.getName())
                .isEmpty();
        }
    }

    @Test
    void findMarkerConflictNamesTheCulprit() {
        RedactionPattern bad = RedactionPattern.compile("bad", "misc", "REDACTED", null);
        PatternSet set = PatternRegistry.builtin().with(bad);

        assertThat(PatternRegistry.findMarkerConflict(set, bad)).contains("bad");
        assertThat(PatternRegistry.mergeCustom(PatternRegistry.builtin(), List.of(bad), "test").contains("bad"))
            .isFalse();
    }
}
