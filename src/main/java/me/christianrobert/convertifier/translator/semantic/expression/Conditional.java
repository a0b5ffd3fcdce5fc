package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * Conditional expression: {@code body if test else orElse}.
 */
public class Conditional implements Expression {

    private final Expression test;
    private final Expression body;
    private final Expression orElse;

    public Conditional(Expression test, Expression body, Expression orElse) {
        if (test == null || body == null || orElse == null) {
            throw new IllegalArgumentException("Conditional parts cannot be null");
        }
        this.test = test;
        this.body = body;
        this.orElse = orElse;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    public Expression getTest() {
        return test;
    }

    public Expression getBody() {
        return body;
    }

    public Expression getOrElse() {
        return orElse;
    }

    @Override
    public String toString() {
        return "Conditional{test=" + test + ", body=" + body + ", orElse=" + orElse + "}";
    }
}
