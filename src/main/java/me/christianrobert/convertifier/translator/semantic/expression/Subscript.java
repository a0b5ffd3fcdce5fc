package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * Single-index subscription: {@code value[index]}. Slices are raw expressions.
 */
public class Subscript implements Expression {

    private final Expression value;
    private final Expression index;

    public Subscript(Expression value, Expression index) {
        if (value == null || index == null) {
            throw new IllegalArgumentException("Subscript value and index cannot be null");
        }
        this.value = value;
        this.index = index;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }

    public Expression getValue() {
        return value;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return "Subscript{value=" + value + ", index=" + index + "}";
    }
}
