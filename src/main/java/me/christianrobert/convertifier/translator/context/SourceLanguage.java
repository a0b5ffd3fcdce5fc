package me.christianrobert.convertifier.translator.context;

import java.util.Locale;

/**
 * Languages the translator accepts as source and produces as target.
 *
 * <p>Translation always goes to the other language: Python → C++ and C++ → Python.
 */
public enum SourceLanguage {

    /**
     * Indentation-significant source, parsed structurally with the ANTLR Python grammar.
     */
    PYTHON("Python"),

    /**
     * Brace-delimited source, rewritten line by line (no parse tree).
     */
    CPP("C++");

    private final String displayName;

    SourceLanguage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Gets the language a source in this language is translated into.
     */
    public SourceLanguage target() {
        return this == PYTHON ? CPP : PYTHON;
    }

    /**
     * Resolves a language from a request parameter.
     *
     * <p>Accepted (case-insensitive): {@code python}, {@code py}, {@code cpp}, {@code c++}.
     *
     * @param name Language name as sent by a client
     * @return Matching language
     * @throws IllegalArgumentException if the name is null or unknown
     */
    public static SourceLanguage fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Language cannot be null or empty");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "python":
            case "py":
                return PYTHON;
            case "cpp":
            case "c++":
                return CPP;
            default:
                throw new IllegalArgumentException("Unsupported language: " + name
                        + " (expected one of: python, py, cpp, c++)");
        }
    }
}
