package me.bechberger.plumbr.commands;

import me.bechberger.plumbr.ConfigLoader;
import me.bechberger.plumbr.Version;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Config generation command - writes the configuration or pattern file template.
 */
@Command(
    name = "generate-config",
    description = "Generate a configuration template (or a custom pattern file template)",
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Generate default template to stdout:",
        "    plumbr generate-config",
        "",
        "  Generate template to file:",
        "    plumbr generate-config -o plumbr.yaml",
        "",
        "  Generate a custom pattern file:",
        "    plumbr generate-config --patterns -o my-patterns.txt",
        ""
    }
)
public class GenerateConfigCommand implements Callable<Integer> {

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Output file (default: stdout)",
        paramLabel = "<output>",
        arity = "0..1"
    )
    private String outputFile;

    @Option(
        names = {"-o", "--output"},
        description = "Output file",
        paramLabel = "<file>"
    )
    private String outputFileOption;

    @Option(
        names = {"--patterns"},
        description = "Generate a custom pattern file template instead of a YAML configuration"
    )
    private boolean patterns;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            String template = new ConfigLoader().loadResource(
                patterns ? ConfigLoader.PATTERN_TEMPLATE : ConfigLoader.CONFIG_TEMPLATE);

            String output = outputFileOption != null ? outputFileOption : outputFile;
            if (output != null) {
                Path path = Path.of(output);
                Files.writeString(path, template);
                err.println((patterns ? "Pattern file" : "Configuration") + " written to: " + path.toAbsolutePath());
            } else {
                out.print(template);
                out.flush();
            }
            return 0;

        } catch (IOException e) {
            err.println("Error generating configuration: " + e.getMessage());
            return 1;
        }
    }
}
