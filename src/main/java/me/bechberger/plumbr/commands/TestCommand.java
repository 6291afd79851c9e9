package me.bechberger.plumbr.commands;

import me.bechberger.plumbr.ConfigLoader;
import me.bechberger.plumbr.Plumbr;
import me.bechberger.plumbr.PlumbrException;
import me.bechberger.plumbr.Version;
import me.bechberger.plumbr.config.RedactorConfig;
import me.bechberger.plumbr.engine.Match;
import me.bechberger.plumbr.engine.PatternSet;
import me.bechberger.plumbr.engine.RedactionPattern;
import me.bechberger.plumbr.engine.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Test command - shows the active patterns and how a value would be redacted.
 * Also functions as a validate command when run without a test value.
 */
@Command(
    name = "test",
    aliases = {"validate"},
    description = {
        "Test a configuration by showing how a value would be redacted",
        "Also validates the configuration and lists the active patterns"
    },
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Validate a configuration:",
        "    plumbr validate --config my-config.yaml",
        "",
        "  Check a custom pattern file:",
        "    plumbr test --patterns my-patterns.txt --value 'order=ORD-123456'",
        "",
        "  See what HIPAA mode redacts:",
        "    plumbr test --compliance hipaa --value 'mail john@example.com from 10.0.0.1'",
        ""
    }
)
public class TestCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(TestCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"--config"},
        description = "Load configuration from a YAML file",
        paramLabel = "<file>"
    )
    private Path configFile;

    @Option(
        names = {"--patterns"},
        description = "Custom pattern file (name|category|regex|replacement per line)",
        paramLabel = "<file>"
    )
    private String patternFile;

    @Option(
        names = {"--pattern-dir"},
        description = "Directory of custom pattern files",
        paramLabel = "<dir>"
    )
    private String patternDir;

    @Option(
        names = {"--compliance"},
        description = "Restrict built-in patterns to compliance profiles: hipaa, pci, gdpr, soc2, all",
        paramLabel = "<profile>",
        split = ","
    )
    private List<String> compliance = new ArrayList<>();

    @Option(
        names = {"--value"},
        description = "Value to test redaction on",
        paramLabel = "<value>"
    )
    private String value;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (INFO level logging)"
    )
    private boolean verbose;

    @Option(
        names = {"--debug"},
        description = "Enable debug output (DEBUG level logging)"
    )
    private boolean debug;

    @Option(
        names = {"-q", "--quiet"},
        description = "Only log errors"
    )
    private boolean quiet;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            RedactorConfig config = CommandSupport.loadConfiguration(configFile, patternFile, patternDir,
                compliance, 1);

            try (Plumbr plumbr = Plumbr.create(config)) {
                boolean isValidationMode = value == null;

                out.println("\n" + "=".repeat(70));
                out.println(isValidationMode ? "Configuration Validation" : "Configuration Test Results");
                out.println("=".repeat(70));
                out.println();

                out.println("Config: " + (configFile != null ? configFile : "<defaults>"));
                if (config.getPatternFile() != null) {
                    out.println("Pattern file: " + config.getPatternFile());
                }
                if (config.getPatternDir() != null) {
                    out.println("Pattern directory: " + config.getPatternDir());
                }
                out.println("Compliance: " + (config.getCompliance().isEmpty() ? "<all built-in patterns>"
                    : String.join(", ", config.getCompliance())));
                out.println();

                if (isValidationMode) {
                    out.println("✓ Configuration is valid");
                    out.println();
                } else {
                    printTestResult(out, plumbr);
                }

                PatternSet patterns = plumbr.getPatterns();
                out.println("Active patterns (" + patterns.size() + "):");
                for (RedactionPattern pattern : patterns) {
                    out.printf("  %-20s %-20s -> %s%n", pattern.getName(), pattern.getCategory(),
                        pattern.getReplacement());
                }
                out.println();
                out.println("=".repeat(70));
            }
            return 0;

        } catch (ConfigLoader.ConfigurationException e) {
            CommandSupport.printConfigurationError(err, e);
            return 1;
        } catch (IOException e) {
            err.println("I/O Error: " + e.getMessage());
            return 1;
        } catch (PlumbrException e) {
            err.println("Error: " + e.getMessage());
            logger.error("Test error", e);
            return 1;
        }
    }

    private void printTestResult(PrintWriter out, Plumbr plumbr) {
        out.println("Value: \"" + value + "\"");
        PatternSet patterns = plumbr.getPatterns();
        List<Match> matches = Scanner.scan(value, patterns);
        if (matches.isEmpty()) {
            out.println("  → Will be KEPT as-is (no matching patterns)");
        } else {
            for (Match match : matches) {
                RedactionPattern pattern = patterns.get(match.patternIndex());
                out.printf("  Match [%d, %d) by %s: \"%s\"%n", match.start(), match.end(), pattern.getName(),
                    value.substring(match.start(), match.end()));
            }
            out.println("  → Will be REDACTED to: \"" + plumbr.redact(value) + "\"");
        }
        out.println();
    }
}
