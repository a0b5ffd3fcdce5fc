package me.christianrobert.convertifier.translator.semantic.expression;

public class UnaryOp implements Expression {

    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryOp(UnaryOperator operator, Expression operand) {
        if (operator == null) {
            throw new IllegalArgumentException("UnaryOp operator cannot be null");
        }
        if (operand == null) {
            throw new IllegalArgumentException("UnaryOp operand cannot be null");
        }
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return "UnaryOp{operator=" + operator + ", operand=" + operand + "}";
    }
}
