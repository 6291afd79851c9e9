package me.bechberger.plumbr.commands;

import me.bechberger.plumbr.ConfigLoader;
import me.bechberger.plumbr.Plumbr;
import me.bechberger.plumbr.PlumbrException;
import me.bechberger.plumbr.Version;
import me.bechberger.plumbr.config.RedactorConfig;
import me.bechberger.plumbr.text.TextStreamRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Redact command - redacts secrets and personal data from logs and other text.
 */
@Command(
    name = "redact",
    description = "Redact secrets and personal data from log files or stdin",
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Filter a log stream:",
        "    tail -f app.log | plumbr redact",
        "",
        "  Redact a file into another file:",
        "    plumbr redact app.log app.redacted.log",
        "",
        "  Only redact what PCI DSS requires, with custom patterns:",
        "    plumbr redact app.log - --compliance pci --patterns my-patterns.txt",
        "",
        "  Show statistics (on stderr):",
        "    plumbr redact app.log out.log --stats",
        ""
    }
)
public class RedactCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RedactCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Input file (default: stdin, also '-')",
        paramLabel = "<input>",
        arity = "0..1"
    )
    private String inputFile;

    @Parameters(
        index = "1",
        description = "Output file (default: stdout, also '-')",
        paramLabel = "<output>",
        arity = "0..1"
    )
    private String outputFile;

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
        description = "Directory of custom pattern files, read in lexicographic order",
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
        names = {"-j", "--threads"},
        description = "Worker threads (default: number of processors, at most 12)",
        paramLabel = "<n>"
    )
    private Integer threads;

    @Option(
        names = {"--stats"},
        description = "Show statistics after redaction (on stderr)"
    )
    private boolean showStats;

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
        // Logging is configured in Main.LoggingAwareExecutionStrategy before this runs
        PrintWriter err = spec.commandLine().getErr();
        boolean fromStdin = inputFile == null || "-".equals(inputFile);
        boolean toStdout = outputFile == null || "-".equals(outputFile);

        if (!fromStdin && !Files.exists(Path.of(inputFile))) {
            logger.error("Input file not found: {}", Path.of(inputFile).toAbsolutePath());
            return 1;
        }

        logger.info("{}", Version.FULL_VERSION);
        logger.info("Input:  {}", fromStdin ? "<stdin>" : Path.of(inputFile).toAbsolutePath());
        logger.info("Output: {}", toStdout ? "<stdout>" : Path.of(outputFile).toAbsolutePath());
        if (configFile != null) {
            logger.info("Config: {}", configFile);
        }

        try {
            RedactorConfig config = CommandSupport.loadConfiguration(configFile, patternFile, patternDir,
                compliance, threads);

            try (Plumbr plumbr = Plumbr.create(config)) {
                logger.info("Using {} patterns on {} thread(s)", plumbr.patternCount(), plumbr.getThreadCount());
                TextStreamRedactor redactor = new TextStreamRedactor(plumbr);

                if (fromStdin && toStdout) {
                    redactor.redactStream(new InputStreamReader(System.in, StandardCharsets.UTF_8),
                        spec.commandLine().getOut());
                } else if (fromStdin) {
                    try (Writer writer = Files.newBufferedWriter(Path.of(outputFile), StandardCharsets.UTF_8)) {
                        redactor.redactStream(new InputStreamReader(System.in, StandardCharsets.UTF_8), writer);
                    }
                } else if (toStdout) {
                    try (Reader reader = Files.newBufferedReader(Path.of(inputFile), StandardCharsets.UTF_8)) {
                        redactor.redactStream(reader, spec.commandLine().getOut());
                    }
                } else {
                    redactor.redactFile(Path.of(inputFile), Path.of(outputFile));
                    logger.info("Output written to: {}", Path.of(outputFile).toAbsolutePath());
                }

                if (showStats) {
                    plumbr.getStats().print(err);
                }
            }
            return 0;

        } catch (ConfigLoader.ConfigurationException e) {
            CommandSupport.printConfigurationError(err, e);
            logger.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            logger.error("I/O Error: {}", e.getMessage());
            if (debug) {
                logger.error("Details:", e);
            }
            return 1;
        } catch (PlumbrException e) {
            logger.error("{}", e.getMessage(), e);
            return 1;
        }
    }
}
