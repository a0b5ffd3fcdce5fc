package me.christianrobert.convertifier.translator.semantic.statement;

/**
 * {@code break} or {@code continue}.
 */
public class LoopControl implements Statement {

    public enum Kind {
        BREAK("break"),
        CONTINUE("continue");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final Kind kind;

    public LoopControl(Kind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Loop control kind cannot be null");
        }
        this.kind = kind;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLoopControl(this);
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "LoopControl{" + kind + "}";
    }
}
