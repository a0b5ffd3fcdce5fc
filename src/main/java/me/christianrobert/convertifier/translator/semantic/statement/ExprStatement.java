package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.expression.Expression;

/**
 * An expression evaluated for its side effect, typically a call.
 */
public class ExprStatement implements Statement {

    private final Expression expression;

    public ExprStatement(Expression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        this.expression = expression;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExprStatement(this);
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return "ExprStatement{" + expression + "}";
    }
}
