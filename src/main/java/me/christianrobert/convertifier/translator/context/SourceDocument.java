package me.christianrobert.convertifier.translator.context;

/**
 * Source text submitted for translation together with its declared language.
 * Immutable once created.
 */
public class SourceDocument {

    private final String text;
    private final SourceLanguage language;

    public SourceDocument(String text, SourceLanguage language) {
        if (language == null) {
            throw new IllegalArgumentException("Source language cannot be null");
        }
        this.text = text == null ? "" : text;
        this.language = language;
    }

    public String getText() {
        return text;
    }

    public SourceLanguage getLanguage() {
        return language;
    }

    public SourceLanguage getTargetLanguage() {
        return language.target();
    }

    @Override
    public String toString() {
        return "SourceDocument{language=" + language + ", length=" + text.length() + "}";
    }
}
