package me.christianrobert.convertifier.translator.semantic.statement;

/**
 * Base class for statements that own a block (def, if, while, for).
 * Keeps the first source line so a translator can name a block it does not walk.
 */
public abstract class CompoundStatement implements Statement {

    private final String headerLine;

    protected CompoundStatement(String headerLine) {
        this.headerLine = headerLine == null ? "" : headerLine.trim();
    }

    /**
     * First physical source line of the statement, trimmed (e.g. {@code if x > 0:}).
     */
    public String getHeaderLine() {
        return headerLine;
    }
}
