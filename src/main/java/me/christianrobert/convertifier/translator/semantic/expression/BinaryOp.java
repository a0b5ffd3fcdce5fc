package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * Binary operation: {@code left OP right}.
 */
public class BinaryOp implements Expression {

    private final Expression left;
    private final BinaryOperator operator;
    private final Expression right;

    public BinaryOp(Expression left, BinaryOperator operator, Expression right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("BinaryOp operands cannot be null");
        }
        if (operator == null) {
            throw new IllegalArgumentException("BinaryOp operator cannot be null");
        }
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "BinaryOp{" + left + " " + operator.getPythonSymbol() + " " + right + "}";
    }
}
