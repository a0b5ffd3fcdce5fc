package me.christianrobert.convertifier.translator.semantic.expression;

import java.util.List;

/**
 * Short-circuit boolean operation over two or more operands.
 */
public class BoolOp implements Expression {

    private final BoolOperator operator;
    private final List<Expression> values;

    public BoolOp(BoolOperator operator, List<Expression> values) {
        if (operator == null) {
            throw new IllegalArgumentException("BoolOp operator cannot be null");
        }
        if (values == null || values.size() < 2) {
            throw new IllegalArgumentException("BoolOp needs at least two operands");
        }
        this.operator = operator;
        this.values = List.copyOf(values);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolOp(this);
    }

    public BoolOperator getOperator() {
        return operator;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "BoolOp{operator=" + operator + ", values=" + values + "}";
    }
}
