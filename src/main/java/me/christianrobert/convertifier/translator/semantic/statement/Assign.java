package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.expression.Expression;

import java.util.List;

/**
 * Assignment. Covers chained assignment ({@code a = b = 0}, several targets)
 * and annotated assignment ({@code x: int = 0}, one target plus annotation).
 *
 * <p>An annotated declaration without a value ({@code x: int}) has a null value.
 */
public class Assign implements Statement {

    private final List<Expression> targets;
    private final Expression value;
    private final Expression annotation;

    public Assign(List<Expression> targets, Expression value, Expression annotation) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("Assignment needs at least one target");
        }
        if (value == null && annotation == null) {
            throw new IllegalArgumentException("Assignment without a value needs an annotation");
        }
        this.targets = List.copyOf(targets);
        this.value = value;
        this.annotation = annotation;
    }

    public Assign(List<Expression> targets, Expression value) {
        this(targets, value, null);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    @Override
    public String toString() {
        return "Assign{targets=" + targets + ", value=" + value
                + (annotation != null ? ", annotation=" + annotation : "") + "}";
    }
}
