package me.christianrobert.convertifier.translator.python;

import java.util.regex.Pattern;

/**
 * Conversion rule backed by a single {@code replaceAll}.
 * The replacement uses {@link java.util.regex.Matcher} group syntax ({@code $1}).
 */
public class RegexConversionRule implements ConversionRule {

    private final String name;
    private final Pattern pattern;
    private final String replacement;

    public RegexConversionRule(String name, String regex, String replacement) {
        if (name == null || regex == null || replacement == null) {
            throw new IllegalArgumentException("Rule name, pattern and replacement cannot be null");
        }
        this.name = name;
        this.pattern = Pattern.compile(regex);
        this.replacement = replacement;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String apply(String line) {
        if (line == null || line.isEmpty()) {
            return line;
        }
        return pattern.matcher(line).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return "RegexConversionRule{name=" + name + ", pattern=" + pattern.pattern() + "}";
    }
}
