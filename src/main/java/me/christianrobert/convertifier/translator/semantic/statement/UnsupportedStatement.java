package me.christianrobert.convertifier.translator.semantic.statement;

import java.util.Arrays;
import java.util.List;

/**
 * A statement outside the translated subset (class, try, with, raise, global, ...),
 * kept as its original source text.
 */
public class UnsupportedStatement implements Statement {

    private final String keyword;
    private final String sourceText;

    public UnsupportedStatement(String keyword, String sourceText) {
        if (sourceText == null) {
            throw new IllegalArgumentException("Unsupported statement source cannot be null");
        }
        this.keyword = keyword == null ? "" : keyword;
        this.sourceText = sourceText;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }

    /**
     * Leading keyword of the statement ({@code class}, {@code try}, {@code @}, ...).
     */
    public String getKeyword() {
        return keyword;
    }

    public String getSourceText() {
        return sourceText;
    }

    /**
     * Non-blank source lines, trailing whitespace removed.
     */
    public List<String> getSourceLines() {
        return Arrays.stream(sourceText.split("\\r?\\n"))
                .map(String::stripTrailing)
                .filter(line -> !line.isBlank())
                .toList();
    }

    @Override
    public String toString() {
        return "UnsupportedStatement{keyword=" + keyword + "}";
    }
}
