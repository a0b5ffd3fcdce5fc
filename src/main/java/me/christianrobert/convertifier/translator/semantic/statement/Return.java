package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.expression.Expression;

public class Return implements Statement {

    private final Expression value;

    public Return(Expression value) {
        this.value = value;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    /**
     * Returned expression, or null for a bare {@code return}.
     */
    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public String toString() {
        return "Return{value=" + value + "}";
    }
}
