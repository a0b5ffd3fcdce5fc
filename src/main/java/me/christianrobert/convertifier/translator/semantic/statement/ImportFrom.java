package me.christianrobert.convertifier.translator.semantic.statement;

import java.util.List;

/**
 * {@code from module import a, b}. The module keeps leading dots of a relative import;
 * a star import has the single name {@code *}.
 */
public class ImportFrom implements Statement {

    private final String module;
    private final List<String> names;

    public ImportFrom(String module, List<String> names) {
        if (module == null || module.isEmpty()) {
            throw new IllegalArgumentException("Import module cannot be null or empty");
        }
        this.module = module;
        this.names = names == null ? List.of() : List.copyOf(names);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitImportFrom(this);
    }

    public String getModule() {
        return module;
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public String toString() {
        return "ImportFrom{module=" + module + ", names=" + names + "}";
    }
}
