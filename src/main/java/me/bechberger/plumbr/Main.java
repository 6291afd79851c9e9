package me.bechberger.plumbr;

import me.bechberger.plumbr.commands.GenerateConfigCommand;
import me.bechberger.plumbr.commands.GenerateSchemaCommand;
import me.bechberger.plumbr.commands.RedactCommand;
import me.bechberger.plumbr.commands.TestCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IExecutionStrategy;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point with subcommands.
 */
@Command(
    name = "plumbr",
    version = Version.FULL_VERSION,
    description = "Redact secrets, keys and personal data from logs",
    mixinStandardHelpOptions = true,
    subcommands = {
        RedactCommand.class,
        TestCommand.class,
        GenerateConfigCommand.class,
        GenerateSchemaCommand.class
    },
    commandListHeading = "%nCommands:%n",
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Redact a log stream:",
        "    kubectl logs my-pod | plumbr redact",
        "",
        "  Redact a file:",
        "    plumbr redact app.log app.redacted.log",
        "",
        "  Generate a configuration template:",
        "    plumbr generate-config -o plumbr.yaml",
        "",
        "  Validate a configuration:",
        "    plumbr validate --config plumbr.yaml",
        "",
        "  Show redaction statistics:",
        "    plumbr redact app.log out.log --stats",
        ""
    }
)
public class Main {

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Command line with the logging aware execution strategy installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setExecutionStrategy(new LoggingAwareExecutionStrategy());
        return cmd;
    }

    /**
     * Applies --debug, --verbose and --quiet of the executed subcommand before it runs,
     * so that its loggers already use the requested level.
     */
    private static class LoggingAwareExecutionStrategy implements IExecutionStrategy {
        @Override
        public int execute(ParseResult parseResult) {
            configureLogging(parseResult);
            return new CommandLine.RunLast().execute(parseResult);
        }

        private void configureLogging(ParseResult parseResult) {
            ParseResult commandResult = parseResult;
            while (commandResult.hasSubcommand()) {
                commandResult = commandResult.subcommand();
            }

            boolean debug = commandResult.hasMatchedOption("--debug");
            boolean verbose = commandResult.hasMatchedOption("--verbose");
            boolean quiet = commandResult.hasMatchedOption("--quiet");

            LoggingConfig.configure(debug, verbose, quiet);
        }
    }
}
