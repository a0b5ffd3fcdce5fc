package me.christianrobert.convertifier.translator.semantic;

import me.christianrobert.convertifier.translator.semantic.statement.Statement;

import java.util.List;

/**
 * Root of the semantic tree: the top-level statements of one Python source.
 */
public class Module implements PyNode {

    private final List<Statement> body;

    public Module(List<Statement> body) {
        if (body == null) {
            throw new IllegalArgumentException("Module body cannot be null");
        }
        this.body = List.copyOf(body);
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }

    @Override
    public String toString() {
        return "Module{body=" + body + "}";
    }
}
