package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * A bare identifier reference.
 */
public class Name implements Expression {

    private final String id;

    public Name(String id) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Name cannot be null or empty");
        }
        this.id = id;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitName(this);
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return "Name{id=" + id + "}";
    }
}
