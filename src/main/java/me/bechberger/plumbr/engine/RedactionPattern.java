package me.bechberger.plumbr.engine;

import org.jetbrains.annotations.Nullable;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single compiled redaction rule.
 * <p>
 * The replacement template may reference {@code {category}} and {@code {name}};
 * it is rendered once at compile time into the marker that replaces every match.
 * <p>
 * If the regular expression declares a named group {@code secret}, only that group
 * is replaced, so {@code password=hunter22} becomes {@code password=[REDACTED:password]}.
 * Otherwise the whole match is replaced.
 */
public final class RedactionPattern {

    /** Template used when a pattern does not define its own replacement */
    public static final String DEFAULT_REPLACEMENT = "[REDACTED:{category}]";

    /** Name of the capture group that narrows the replaced span */
    public static final String SECRET_GROUP = "secret";

    private final String name;
    private final String category;
    private final Pattern regex;
    private final String replacementTemplate;
    private final String replacement;
    private final boolean secretGroup;

    private RedactionPattern(String name, String category, Pattern regex, String replacementTemplate) {
        this.name = name;
        this.category = category;
        this.regex = regex;
        this.replacementTemplate = replacementTemplate;
        this.replacement = replacementTemplate
            .replace("{category}", category)
            .replace("{name}", name);
        this.secretGroup = regex.pattern().contains("(?<" + SECRET_GROUP + ">");
    }

    /**
     * Compile a pattern.
     *
     * @param name                unique name within a pattern set
     * @param category            category shown in the redaction marker
     * @param regex               java.util.regex syntax
     * @param replacementTemplate marker template, {@code null} or blank for {@link #DEFAULT_REPLACEMENT}
     * @throws PatternSyntaxException   if the regex does not compile
     * @throws IllegalArgumentException if name, category or regex is blank
     */
    public static RedactionPattern compile(String name, String category, String regex,
                                           @Nullable String replacementTemplate) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pattern name must not be empty");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Pattern category must not be empty (pattern '" + name + "')");
        }
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("Pattern regex must not be empty (pattern '" + name + "')");
        }
        String template = replacementTemplate == null || replacementTemplate.isBlank()
            ? DEFAULT_REPLACEMENT
            : replacementTemplate;
        return new RedactionPattern(name, category, Pattern.compile(regex), template);
    }

    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    public Pattern getRegex() {
        return regex;
    }

    public String getReplacementTemplate() {
        return replacementTemplate;
    }

    /**
     * The rendered marker inserted in place of each match.
     */
    public String getReplacement() {
        return replacement;
    }

    /**
     * Whether only the {@code secret} group of a match is replaced.
     */
    public boolean hasSecretGroup() {
        return secretGroup;
    }

    @Override
    public String toString() {
        return name + " (" + category + "): " + regex.pattern() + " -> " + replacement;
    }
}
