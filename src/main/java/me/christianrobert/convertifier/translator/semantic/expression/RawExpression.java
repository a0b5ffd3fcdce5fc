package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * Expression outside the translated subset (tuple, dict, set, lambda, comprehension,
 * slice, starred argument, ellipsis), kept as its original source text.
 */
public class RawExpression implements Expression {

    private final String sourceText;

    public RawExpression(String sourceText) {
        if (sourceText == null) {
            throw new IllegalArgumentException("Raw expression text cannot be null");
        }
        this.sourceText = sourceText;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRawExpression(this);
    }

    public String getSourceText() {
        return sourceText;
    }

    @Override
    public String toString() {
        return sourceText;
    }
}
