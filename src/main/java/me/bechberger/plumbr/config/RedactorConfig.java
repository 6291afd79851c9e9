package me.bechberger.plumbr.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration of a redactor instance.
 * <p>
 * Example YAML:
 * <pre>
 * pattern_file: patterns/custom.txt
 * pattern_dir: /etc/plumbr/patterns.d
 * compliance: [hipaa, pci]
 * num_threads: 0
 * quiet: true
 * </pre>
 * Relative paths in a file are resolved against the directory of that file.
 * An instance keeps its own {@link #copy()}, changes made afterwards have no effect on it.
 */
public class RedactorConfig {

    @JsonProperty("pattern_file")
    @JsonPropertyDescription("Custom pattern file (name|category|regex|replacement per line), merged over the built-in patterns")
    private String patternFile;

    @JsonProperty("pattern_dir")
    @JsonPropertyDescription("Directory of pattern files, read in lexicographic order after pattern_file")
    private String patternDir;

    @JsonProperty("compliance")
    @JsonPropertyDescription("Compliance profiles (hipaa, pci, gdpr, soc2, all) restricting the built-in patterns")
    private Set<String> compliance = new LinkedHashSet<>();

    @JsonProperty("num_threads")
    @JsonPropertyDescription("Worker threads for batch redaction, 0 = number of processors (at most 12)")
    private int numThreads = 0;

    @JsonProperty("quiet")
    @JsonPropertyDescription("Do not log a statistics summary when the redactor is closed")
    private boolean quiet = true;

    @Nullable
    public String getPatternFile() { return patternFile; }
    public void setPatternFile(@Nullable String patternFile) { this.patternFile = patternFile; }

    @Nullable
    public String getPatternDir() { return patternDir; }
    public void setPatternDir(@Nullable String patternDir) { this.patternDir = patternDir; }

    public Set<String> getCompliance() { return compliance; }
    public void setCompliance(Set<String> compliance) {
        this.compliance = compliance == null ? new LinkedHashSet<>() : new LinkedHashSet<>(compliance);
    }

    public int getNumThreads() { return numThreads; }
    public void setNumThreads(int numThreads) { this.numThreads = numThreads; }

    public boolean isQuiet() { return quiet; }
    public void setQuiet(boolean quiet) { this.quiet = quiet; }

    /**
     * Deep copy.
     */
    public RedactorConfig copy() {
        RedactorConfig copy = new RedactorConfig();
        copy.patternFile = patternFile;
        copy.patternDir = patternDir;
        copy.compliance = new LinkedHashSet<>(compliance);
        copy.numThreads = numThreads;
        copy.quiet = quiet;
        return copy;
    }

    /**
     * Resolve relative pattern paths against a base directory, usually the directory
     * of the YAML file this configuration was read from.
     */
    public void resolvePaths(Path baseDir) {
        patternFile = resolve(baseDir, patternFile);
        patternDir = resolve(baseDir, patternDir);
    }

    @Nullable
    private static String resolve(Path baseDir, @Nullable String path) {
        if (path == null || path.isBlank()) {
            return path;
        }
        Path p = Path.of(path);
        return p.isAbsolute() ? path : baseDir.resolve(p).normalize().toString();
    }

    /**
     * Apply CLI options to override configuration values
     */
    public void applyCliOptions(@Nullable CliOptions cliOptions) {
        if (cliOptions == null) return;

        if (cliOptions.getPatternFile() != null) {
            patternFile = cliOptions.getPatternFile();
        }
        if (cliOptions.getPatternDir() != null) {
            patternDir = cliOptions.getPatternDir();
        }
        if (!cliOptions.getCompliance().isEmpty()) {
            compliance.addAll(cliOptions.getCompliance());
        }
        if (cliOptions.getNumThreads() != null) {
            numThreads = cliOptions.getNumThreads();
        }
        if (cliOptions.getQuiet() != null) {
            quiet = cliOptions.getQuiet();
        }
    }

    @Override
    public String toString() {
        return "RedactorConfig{pattern_file=" + patternFile + ", pattern_dir=" + patternDir +
            ", compliance=" + compliance + ", num_threads=" + numThreads + ", quiet=" + quiet + "}";
    }

    /**
     * CLI options to be applied on top of configuration
     */
    public static class CliOptions {
        private String patternFile;
        private String patternDir;
        private List<String> compliance = new ArrayList<>();
        private Integer numThreads;
        private Boolean quiet;

        public String getPatternFile() { return patternFile; }
        public void setPatternFile(String patternFile) { this.patternFile = patternFile; }

        public String getPatternDir() { return patternDir; }
        public void setPatternDir(String patternDir) { this.patternDir = patternDir; }

        public List<String> getCompliance() { return compliance; }
        public void setCompliance(List<String> compliance) {
            this.compliance = compliance == null ? new ArrayList<>() : compliance;
        }

        public Integer getNumThreads() { return numThreads; }
        public void setNumThreads(Integer numThreads) { this.numThreads = numThreads; }

        public Boolean getQuiet() { return quiet; }
        public void setQuiet(Boolean quiet) { this.quiet = quiet; }
    }
}
