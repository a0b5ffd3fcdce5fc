package me.christianrobert.convertifier.translator.semantic.expression;

import java.util.List;

/**
 * Comparison chain: {@code left op1 c1 op2 c2 ...}.
 * There is always exactly one comparator per operator.
 */
public class Compare implements Expression {

    private final Expression left;
    private final List<ComparisonOperator> operators;
    private final List<Expression> comparators;

    public Compare(Expression left, List<ComparisonOperator> operators, List<Expression> comparators) {
        if (left == null) {
            throw new IllegalArgumentException("Compare left operand cannot be null");
        }
        if (operators == null || comparators == null || operators.isEmpty()) {
            throw new IllegalArgumentException("Compare needs at least one operator");
        }
        if (operators.size() != comparators.size()) {
            throw new IllegalArgumentException("Compare needs one comparator per operator, got "
                    + operators.size() + " operators and " + comparators.size() + " comparators");
        }
        this.left = left;
        this.operators = List.copyOf(operators);
        this.comparators = List.copyOf(comparators);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }

    public Expression getLeft() {
        return left;
    }

    public List<ComparisonOperator> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    public boolean isChained() {
        return operators.size() > 1;
    }

    @Override
    public String toString() {
        return "Compare{left=" + left + ", operators=" + operators + ", comparators=" + comparators + "}";
    }
}
