package me.bechberger.plumbr;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import me.bechberger.plumbr.config.PatternDefinition;
import me.bechberger.plumbr.config.RedactorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads YAML configuration files and the bundled resources (built-in pattern table,
 * templates) with error messages that point at the offending line.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    /** Classpath location of the built-in pattern table */
    public static final String BUILTIN_PATTERNS = "/patterns/builtin.yaml";

    /** Classpath location of the commented configuration template */
    public static final String CONFIG_TEMPLATE = "/config-template.yaml";

    /** Classpath location of the custom pattern file template */
    public static final String PATTERN_TEMPLATE = "/patterns/custom-template.txt";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigLoader() {
        yamlMapper.findAndRegisterModules();
    }

    /**
     * Load a configuration file. Relative pattern paths in it are resolved against the
     * directory that contains the file.
     *
     * @throws ConfigurationException if the file is missing, empty or invalid
     */
    public RedactorConfig load(Path file) throws IOException {
        logger.debug("Loading configuration from file: {}", file.toAbsolutePath());

        if (!Files.exists(file)) {
            throw new ConfigurationException(
                "Configuration file not found: " + file.toAbsolutePath() + "\n" +
                "Please check the file path and ensure the file exists.\n" +
                "You can create a configuration file with 'plumbr generate-config'."
            );
        }

        if (!Files.isReadable(file)) {
            throw new ConfigurationException(
                "Configuration file is not readable: " + file.toAbsolutePath() + "\n" +
                "Please check file permissions."
            );
        }

        if (Files.size(file) == 0) {
            throw new ConfigurationException(
                "Configuration file is empty: " + file.toAbsolutePath() + "\n" +
                "Please add configuration content or omit --config to use the defaults."
            );
        }

        try {
            RedactorConfig config = yamlMapper.readValue(file.toFile(), RedactorConfig.class);
            if (config == null) {
                // a file with only comments
                config = new RedactorConfig();
            }
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                config.resolvePaths(parent);
            }
            logger.info("Successfully loaded configuration from: {}", file);
            return config;
        } catch (UnrecognizedPropertyException e) {
            String nearbyText = extractNearbyText(file, e.getLocation().getLineNr());
            throw new ConfigurationException(
                "Invalid configuration property in file: " + file.toAbsolutePath() + "\n" +
                "Unknown property: '" + e.getPropertyName() + "' at line " + e.getLocation().getLineNr() + "\n" +
                nearbyText +
                "Valid properties: pattern_file, pattern_dir, compliance, num_threads, quiet"
            );
        } catch (JsonParseException e) {
            throw new ConfigurationException(
                "YAML syntax error in file: " + file.toAbsolutePath() + "\n" +
                "Line " + e.getLocation().getLineNr() + ", column " + e.getLocation().getColumnNr() + "\n" +
                "Error: " + e.getOriginalMessage() + "\n" +
                "Common issues:\n" +
                "  - Incorrect indentation (YAML requires consistent spacing)\n" +
                "  - Missing colon after property name\n" +
                "  - Tabs instead of spaces (use spaces for indentation)"
            );
        } catch (JsonMappingException e) {
            throw new ConfigurationException(
                "Invalid value in configuration file: " + file.toAbsolutePath() + "\n" +
                "Error: " + e.getOriginalMessage() + "\n" +
                "Please check the types: num_threads is a number, quiet is true/false, compliance is a list."
            );
        } catch (IOException e) {
            if (e instanceof ConfigurationException) {
                throw e;
            }
            throw new ConfigurationException(
                "Failed to load configuration from file: " + file.toAbsolutePath() + "\n" +
                "Error: " + e.getMessage(),
                e
            );
        }
    }

    /**
     * Load the built-in pattern table bundled with the library.
     */
    public List<PatternDefinition> loadBuiltinPatterns() throws IOException {
        try (InputStream is = getClass().getResourceAsStream(BUILTIN_PATTERNS)) {
            if (is == null) {
                throw new ConfigurationException("Built-in pattern table not found on class path: " + BUILTIN_PATTERNS);
            }
            PatternDefinition.Table table = yamlMapper.readValue(is, PatternDefinition.Table.class);
            logger.debug("Loaded {} built-in pattern definitions", table.getPatterns().size());
            return table.getPatterns();
        } catch (UnrecognizedPropertyException e) {
            throw new ConfigurationException(
                "Invalid property in built-in pattern table: " + e.getPropertyName() + "\n" +
                "This is likely a bug in the pattern table. Please report this issue."
            );
        }
    }

    /**
     * Read a bundled text resource, e.g. {@link #CONFIG_TEMPLATE}.
     */
    public String loadResource(String resource) throws IOException {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Resource not found on class path: " + resource);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Extract nearby text from file for better error context.
     */
    private String extractNearbyText(Path file, int errorLine) {
        try {
            List<String> lines = Files.readAllLines(file);
            if (errorLine > 0 && errorLine <= lines.size()) {
                int start = Math.max(0, errorLine - 3);
                int end = Math.min(lines.size(), errorLine + 2);
                StringBuilder context = new StringBuilder("\nNear line " + errorLine + ":\n");
                for (int i = start; i < end; i++) {
                    String prefix = (i == errorLine - 1) ? ">>> " : "    ";
                    context.append(String.format("%s%4d: %s\n", prefix, i + 1, lines.get(i)));
                }
                return context.toString();
            }
        } catch (IOException e) {
            logger.debug("Cannot read {} for error context: {}", file, e.getMessage());
        }
        return "";
    }

    /**
     * Custom exception for configuration errors with helpful messages.
     */
    public static class ConfigurationException extends IOException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
