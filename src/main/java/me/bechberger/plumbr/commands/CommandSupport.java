package me.bechberger.plumbr.commands;

import me.bechberger.plumbr.ConfigLoader;
import me.bechberger.plumbr.config.RedactorConfig;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Helpers shared by the commands.
 */
final class CommandSupport {

    private CommandSupport() {
        // Utility class
    }

    /**
     * Load the configuration file (or the defaults) and apply the command line overrides.
     */
    static RedactorConfig loadConfiguration(@Nullable Path configFile, @Nullable String patternFile,
                                            @Nullable String patternDir, List<String> compliance,
                                            @Nullable Integer threads) throws IOException {
        RedactorConfig config = configFile != null ? new ConfigLoader().load(configFile) : new RedactorConfig();

        RedactorConfig.CliOptions cliOptions = new RedactorConfig.CliOptions();
        cliOptions.setPatternFile(patternFile);
        cliOptions.setPatternDir(patternDir);
        cliOptions.setCompliance(compliance);
        cliOptions.setNumThreads(threads);
        config.applyCliOptions(cliOptions);
        return config;
    }

    /**
     * Print a configuration error framed, without stack trace.
     */
    static void printConfigurationError(PrintWriter err, ConfigLoader.ConfigurationException e) {
        err.println("\n" + "=".repeat(70));
        err.println("Configuration Error");
        err.println("=".repeat(70));
        err.println(e.getMessage());
        err.println("=".repeat(70));
        err.println("\nFor help, see:");
        err.println("  - plumbr generate-config (commented configuration template)");
        err.println("  - plumbr generate-config --patterns (pattern file template)");
        err.flush();
    }
}
