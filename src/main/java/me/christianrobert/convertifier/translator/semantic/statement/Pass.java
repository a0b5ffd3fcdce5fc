package me.christianrobert.convertifier.translator.semantic.statement;

public class Pass implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPass(this);
    }

    @Override
    public String toString() {
        return "Pass";
    }
}
