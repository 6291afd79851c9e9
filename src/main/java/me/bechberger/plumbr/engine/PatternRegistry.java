package me.bechberger.plumbr.engine;

import me.bechberger.plumbr.ConfigLoader;
import me.bechberger.plumbr.ConstructionException;
import me.bechberger.plumbr.PatternLoadException;
import me.bechberger.plumbr.config.PatternDefinition;
import me.bechberger.plumbr.config.RedactorConfig;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the active pattern set of an instance.
 * <p>
 * Sources are merged in a fixed order, later patterns replacing earlier ones of the same
 * name in place:
 * <ol>
 *     <li>the built-in table, restricted to the selected compliance profiles (if any)</li>
 *     <li>{@code pattern_file}</li>
 *     <li>every regular, non-hidden file in {@code pattern_dir}, in lexicographic order</li>
 * </ol>
 * A pattern source that is named but missing is an error, there is no silent fallback
 * to the defaults.
 * <p>
 * No marker of the resulting set may be matched by any of its patterns, otherwise
 * redacting already redacted text would change it again. Custom patterns that break
 * this are skipped with a warning.
 */
public final class PatternRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PatternRegistry.class);

    private static volatile Builtins builtins;

    private PatternRegistry() {
        // Utility class
    }

    private record Builtins(List<PatternDefinition> definitions, PatternSet patterns) {
    }

    /**
     * Build the pattern set for a configuration.
     *
     * @throws PatternLoadException  if a named pattern source cannot be loaded or a compliance
     *                               profile is unknown
     * @throws ConstructionException if the built-in pattern table is broken
     */
    public static PatternSet build(RedactorConfig config) throws PatternLoadException {
        PatternSet patterns = selectBuiltins(config.getCompliance());
        if (config.getPatternFile() != null && !config.getPatternFile().isBlank()) {
            patterns = mergeFile(patterns, Path.of(config.getPatternFile()));
        }
        if (config.getPatternDir() != null && !config.getPatternDir().isBlank()) {
            for (Path file : listPatternFiles(Path.of(config.getPatternDir()))) {
                patterns = mergeFile(patterns, file);
            }
        }
        logger.debug("Active patterns ({}): {}", patterns.size(), patterns.names());
        return patterns;
    }

    /**
     * All built-in patterns.
     */
    public static PatternSet builtin() {
        return builtins().patterns();
    }

    public static List<PatternDefinition> builtinDefinitions() {
        return builtins().definitions();
    }

    /**
     * Built-in patterns selected by compliance profile names; empty selects everything.
     *
     * @throws PatternLoadException if a profile name is unknown
     */
    public static PatternSet selectBuiltins(Collection<String> profileNames) throws PatternLoadException {
        Builtins table = builtins();
        Set<ComplianceProfile> profiles = resolveProfiles(profileNames);
        if (profiles.isEmpty() || profiles.contains(ComplianceProfile.ALL)) {
            return table.patterns();
        }
        Set<String> selected = table.definitions().stream()
            .filter(d -> profiles.stream().anyMatch(p -> d.belongsTo(p.getName())))
            .map(PatternDefinition::getName)
            .collect(Collectors.toSet());
        PatternSet result = table.patterns().filter(p -> selected.contains(p.getName()));
        logger.debug("Compliance profiles {} select {} built-in pattern(s)", profiles, result.size());
        return result;
    }

    public static Set<ComplianceProfile> resolveProfiles(Collection<String> profileNames) throws PatternLoadException {
        Set<ComplianceProfile> profiles = new LinkedHashSet<>();
        for (String name : profileNames) {
            ComplianceProfile profile = ComplianceProfile.fromName(name);
            if (profile == null) {
                throw new PatternLoadException(
                    "Unknown compliance profile: '" + name + "'\n" +
                    "Available profiles: " + ComplianceProfile.availableNames());
            }
            profiles.add(profile);
        }
        return profiles;
    }

    /**
     * Regular, non-hidden files of a pattern directory in lexicographic order.
     */
    static List<Path> listPatternFiles(Path dir) throws PatternLoadException {
        if (!Files.exists(dir)) {
            throw new PatternLoadException(
                "Pattern directory not found: " + dir.toAbsolutePath() + "\n" +
                "Please check the path and ensure the directory exists.");
        }
        if (!Files.isDirectory(dir)) {
            throw new PatternLoadException("Pattern directory is not a directory: " + dir.toAbsolutePath());
        }
        try (Stream<Path> entries = Files.list(dir)) {
            List<Path> files = entries
                .filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                .collect(Collectors.toList());
            if (files.isEmpty()) {
                logger.warn("Pattern directory {} contains no pattern files", dir);
            }
            return files;
        } catch (IOException e) {
            throw new PatternLoadException(
                "Failed to read pattern directory: " + dir.toAbsolutePath() + "\n" +
                "Error: " + e.getMessage(), e);
        }
    }

    static PatternSet mergeFile(PatternSet base, Path file) throws PatternLoadException {
        PatternFileParser.ParsedFile parsed = PatternFileParser.parse(file);
        String source = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        return mergeCustom(base, parsed.patterns(), source);
    }

    /**
     * Merge custom patterns one by one, skipping those that would break marker stability.
     */
    static PatternSet mergeCustom(PatternSet base, List<RedactionPattern> custom, String source) {
        PatternSet result = base;
        for (RedactionPattern pattern : custom) {
            PatternSet candidate = result.with(pattern);
            String conflict = findMarkerConflict(candidate, pattern);
            if (conflict != null) {
                logger.warn("{}: Skipping pattern '{}': {}", source, pattern.getName(), conflict);
                continue;
            }
            if (result.contains(pattern.getName())) {
                logger.debug("{}: pattern '{}' overrides an earlier definition", source, pattern.getName());
            }
            result = candidate;
        }
        return result;
    }

    /**
     * Check that the new pattern neither has a marker that the set would redact
     * nor redacts any marker already in the set.
     *
     * @return a description of the conflict, {@code null} if there is none
     */
    @Nullable
    static String findMarkerConflict(PatternSet set, RedactionPattern added) {
        List<Match> own = Scanner.scan(added.getReplacement(), set);
        if (!own.isEmpty()) {
            return "its marker '" + added.getReplacement() + "' would be matched by pattern '" +
                set.get(own.get(0).patternIndex()).getName() + "'";
        }
        PatternSet single = PatternSet.of(List.of(added));
        for (RedactionPattern other : set) {
            if (other != added && !Scanner.scan(other.getReplacement(), single).isEmpty()) {
                return "it matches the marker '" + other.getReplacement() + "' of pattern '" + other.getName() + "'";
            }
        }
        return null;
    }

    private static Builtins builtins() {
        Builtins loaded = builtins;
        if (loaded == null) {
            synchronized (PatternRegistry.class) {
                loaded = builtins;
                if (loaded == null) {
                    loaded = loadBuiltins();
                    builtins = loaded;
                }
            }
        }
        return loaded;
    }

    private static Builtins loadBuiltins() {
        List<PatternDefinition> definitions;
        try {
            definitions = new ConfigLoader().loadBuiltinPatterns();
        } catch (IOException e) {
            throw new ConstructionException("cannot load built-in patterns: " + e.getMessage(), e);
        }
        List<RedactionPattern> compiled = new ArrayList<>(definitions.size());
        for (PatternDefinition definition : definitions) {
            try {
                compiled.add(definition.compile());
            } catch (IllegalArgumentException e) {
                throw new ConstructionException("invalid built-in pattern '" + definition.getName() + "'", e);
            }
        }
        PatternSet patterns = PatternSet.of(compiled);
        for (RedactionPattern pattern : patterns) {
            String conflict = findMarkerConflict(patterns, pattern);
            if (conflict != null) {
                throw new ConstructionException("built-in pattern '" + pattern.getName() + "' is unstable: " + conflict);
            }
        }
        logger.debug("Compiled {} built-in patterns", patterns.size());
        return new Builtins(List.copyOf(definitions), patterns);
    }
}
