package me.christianrobert.convertifier.translator.parser;

import org.antlr.v4.runtime.ParserRuleContext;

import java.util.List;

/**
 * Parse tree of a Python module plus the lexer and parser errors, each formatted
 * as {@code Line <line>:<column> - <message>}. The tree is always present; with
 * errors it contains ANTLR's recovery nodes and must not be translated.
 */
public class ParseResult {

    private final ParserRuleContext tree;
    private final List<String> errors;

    public ParseResult(ParserRuleContext tree, List<String> errors) {
        this.tree = tree;
        this.errors = List.copyOf(errors);
    }

    public ParserRuleContext getTree() {
        return tree;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * All errors joined with {@code "; "} in the order they were reported, or null without errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("; ", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
