package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.ListDisplay;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for parenthesised and bracketed atoms.
 *
 * <p>{@code (x)} is just {@code x}; the C++ side adds its own parentheses.
 * Tuples, generators, comprehensions and starred elements stay raw.
 */
public class VisitAtom {

    public static Expression v(PythonParser.ParenAtomContext ctx, SemanticTreeBuilder b) {
        PythonParser.Testlist_compContext content = ctx.testlist_comp();
        if (isSingleElement(content)) {
            return b.expression(content.test(0));
        }
        return b.raw(ctx);
    }

    public static Expression v(PythonParser.ListAtomContext ctx, SemanticTreeBuilder b) {
        PythonParser.Testlist_compContext content = ctx.testlist_comp();
        if (content == null) {
            return new ListDisplay(List.of());
        }
        if (content.comp_for() != null || !content.star_expr().isEmpty()) {
            return b.raw(ctx);
        }
        List<Expression> elements = new ArrayList<>();
        for (PythonParser.TestContext element : content.test()) {
            elements.add(b.expression(element));
        }
        return new ListDisplay(elements);
    }

    private static boolean isSingleElement(PythonParser.Testlist_compContext ctx) {
        return ctx != null
                && ctx.getChildCount() == 1
                && ctx.test().size() == 1;
    }
}
