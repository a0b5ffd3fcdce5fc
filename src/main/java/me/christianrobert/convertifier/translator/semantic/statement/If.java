package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.expression.Expression;

import java.util.List;

/**
 * If statement with its elif chain kept flat: the first branch is the {@code if},
 * every following branch is an {@code elif}. {@code orElse} is empty when there is
 * no {@code else} block.
 */
public class If extends CompoundStatement {

    /**
     * One condition and the block it guards.
     */
    public static class Branch {

        private final Expression test;
        private final List<Statement> body;

        public Branch(Expression test, List<Statement> body) {
            if (test == null) {
                throw new IllegalArgumentException("Branch condition cannot be null");
            }
            this.test = test;
            this.body = body == null ? List.of() : List.copyOf(body);
        }

        public Expression getTest() {
            return test;
        }

        public List<Statement> getBody() {
            return body;
        }

        @Override
        public String toString() {
            return "Branch{test=" + test + ", body=" + body + "}";
        }
    }

    private final List<Branch> branches;
    private final List<Statement> orElse;

    public If(List<Branch> branches, List<Statement> orElse, String headerLine) {
        super(headerLine);
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("If statement needs at least one branch");
        }
        this.branches = List.copyOf(branches);
        this.orElse = orElse == null ? List.of() : List.copyOf(orElse);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public boolean hasElse() {
        return !orElse.isEmpty();
    }

    @Override
    public String toString() {
        return "If{branches=" + branches + ", orElse=" + orElse + "}";
    }
}
