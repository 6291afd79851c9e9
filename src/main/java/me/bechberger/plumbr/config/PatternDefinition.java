package me.bechberger.plumbr.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.bechberger.plumbr.engine.RedactionPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Uncompiled pattern as written in the built-in pattern table.
 */
public class PatternDefinition {

    @JsonProperty("name")
    private String name;

    /**
     * Defaults to the name.
     */
    @JsonProperty("category")
    private String category;

    @JsonProperty("regex")
    private String regex;

    @JsonProperty("replacement")
    private String replacement;

    @JsonProperty("description")
    private String description;

    /**
     * Compliance profiles (hipaa, pci, gdpr, soc2) this pattern belongs to.
     */
    @JsonProperty("profiles")
    private List<String> profiles = new ArrayList<>();

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCategory() { return category != null ? category : name; }
    public void setCategory(String category) { this.category = category; }

    public String getRegex() { return regex; }
    public void setRegex(String regex) { this.regex = regex; }

    public String getReplacement() { return replacement; }
    public void setReplacement(String replacement) { this.replacement = replacement; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public List<String> getProfiles() { return profiles; }
    public void setProfiles(List<String> profiles) { this.profiles = profiles; }

    public boolean belongsTo(String profile) {
        return profiles.stream().anyMatch(p -> p.equalsIgnoreCase(profile));
    }

    public RedactionPattern compile() {
        return RedactionPattern.compile(name, getCategory(), regex, replacement);
    }

    /**
     * Root of the built-in pattern table file.
     */
    public static class Table {
        @JsonProperty("patterns")
        private List<PatternDefinition> patterns = new ArrayList<>();

        public List<PatternDefinition> getPatterns() { return patterns; }
        public void setPatterns(List<PatternDefinition> patterns) { this.patterns = patterns; }
    }
}
