package me.christianrobert.convertifier.translator.semantic.expression;

import java.util.List;

/**
 * List display without comprehension: {@code [a, b, c]}.
 */
public class ListDisplay implements Expression {

    private final List<Expression> elements;

    public ListDisplay(List<Expression> elements) {
        this.elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitListDisplay(this);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public String toString() {
        return "ListDisplay{elements=" + elements + "}";
    }
}
