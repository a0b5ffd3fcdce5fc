package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * Attribute access: {@code value.attr}.
 */
public class Attribute implements Expression {

    private final Expression value;
    private final String attr;

    public Attribute(Expression value, String attr) {
        if (value == null) {
            throw new IllegalArgumentException("Attribute value cannot be null");
        }
        if (attr == null || attr.isEmpty()) {
            throw new IllegalArgumentException("Attribute name cannot be null or empty");
        }
        this.value = value;
        this.attr = attr;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    public Expression getValue() {
        return value;
    }

    public String getAttr() {
        return attr;
    }

    @Override
    public String toString() {
        return "Attribute{value=" + value + ", attr=" + attr + "}";
    }
}
