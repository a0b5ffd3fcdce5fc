package me.christianrobert.convertifier.translator.semantic.statement;

import java.util.List;

/**
 * {@code import a.b, c as d}. Only the dotted module names are kept.
 */
public class Import implements Statement {

    private final List<String> modules;

    public Import(List<String> modules) {
        if (modules == null || modules.isEmpty()) {
            throw new IllegalArgumentException("Import needs at least one module");
        }
        this.modules = List.copyOf(modules);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitImport(this);
    }

    public List<String> getModules() {
        return modules;
    }

    @Override
    public String toString() {
        return "Import{modules=" + modules + "}";
    }
}
