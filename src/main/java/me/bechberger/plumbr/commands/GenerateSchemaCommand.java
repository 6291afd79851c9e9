package me.bechberger.plumbr.commands;

import com.fasterxml.jackson.databind.JsonNode;
import me.bechberger.plumbr.Version;
import me.bechberger.plumbr.config.SchemaGenerator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Generate JSON Schema command - JSON schema of the YAML configuration file.
 */
@Command(
    name = "generate-schema",
    description = "Generate JSON Schema for the YAML configuration file",
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Generate schema to stdout:",
        "    plumbr generate-schema",
        "",
        "  Generate schema to a file:",
        "    plumbr generate-schema plumbr-schema.json",
        ""
    }
)
public class GenerateSchemaCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Output file for the JSON schema (default: stdout)",
        paramLabel = "<output.json>",
        arity = "0..1"
    )
    private String outputFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            JsonNode schema = SchemaGenerator.generateSchema();
            String schemaJson = schema.toPrettyString();

            if (outputFile != null) {
                Path outputPath = Path.of(outputFile).toAbsolutePath();
                Files.createDirectories(outputPath.getParent());
                Files.writeString(outputPath, schemaJson);
                err.println("✓ Schema written to: " + outputPath);
            } else {
                out.println(schemaJson);
            }
            return 0;
        } catch (IOException e) {
            err.println("Error generating schema: " + e.getMessage());
            return 1;
        }
    }
}
