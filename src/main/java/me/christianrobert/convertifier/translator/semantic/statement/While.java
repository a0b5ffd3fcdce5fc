package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.expression.Expression;

import java.util.List;

public class While extends CompoundStatement {

    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public While(Expression test, List<Statement> body, List<Statement> orElse, String headerLine) {
        super(headerLine);
        if (test == null) {
            throw new IllegalArgumentException("While condition cannot be null");
        }
        this.test = test;
        this.body = body == null ? List.of() : List.copyOf(body);
        this.orElse = orElse == null ? List.of() : List.copyOf(orElse);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    /**
     * Statements of the loop's {@code else} block, empty when absent.
     */
    public List<Statement> getOrElse() {
        return orElse;
    }

    @Override
    public String toString() {
        return "While{test=" + test + ", body=" + body + "}";
    }
}
