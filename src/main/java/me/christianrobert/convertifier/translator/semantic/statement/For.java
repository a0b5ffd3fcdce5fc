package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.expression.Expression;

import java.util.List;

/**
 * For loop: {@code for target in iter: body}.
 */
public class For extends CompoundStatement {

    private final Expression target;
    private final Expression iter;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public For(Expression target, Expression iter, List<Statement> body, List<Statement> orElse,
               String headerLine) {
        super(headerLine);
        if (target == null || iter == null) {
            throw new IllegalArgumentException("For loop target and iterable cannot be null");
        }
        this.target = target;
        this.iter = iter;
        this.body = body == null ? List.of() : List.copyOf(body);
        this.orElse = orElse == null ? List.of() : List.copyOf(orElse);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    @Override
    public String toString() {
        return "For{target=" + target + ", iter=" + iter + ", body=" + body + "}";
    }
}
