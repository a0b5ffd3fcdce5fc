package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.expression.BinaryOperator;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;

/**
 * Augmented assignment: {@code target OP= value}.
 */
public class AugAssign implements Statement {

    private final Expression target;
    private final BinaryOperator operator;
    private final Expression value;

    public AugAssign(Expression target, BinaryOperator operator, Expression value) {
        if (target == null || operator == null || value == null) {
            throw new IllegalArgumentException("Augmented assignment parts cannot be null");
        }
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAugAssign(this);
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "AugAssign{target=" + target + ", operator=" + operator + ", value=" + value + "}";
    }
}
