package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.BoolOp;
import me.christianrobert.convertifier.translator.semantic.expression.BoolOperator;
import me.christianrobert.convertifier.translator.semantic.expression.Conditional;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.UnaryOp;
import me.christianrobert.convertifier.translator.semantic.expression.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for the boolean layer of the expression grammar:
 * conditional expressions, {@code or}, {@code and}, {@code not}, and testlists.
 */
public class VisitTest {

    public static Expression v(PythonParser.ConditionalTestContext ctx, SemanticTreeBuilder b) {
        List<PythonParser.Or_testContext> parts = ctx.or_test();
        if (parts.size() == 1) {
            return b.expression(parts.get(0));
        }
        // body if test else orElse
        return new Conditional(b.expression(parts.get(1)), b.expression(parts.get(0)), b.expression(ctx.test()));
    }

    public static Expression v(PythonParser.Or_testContext ctx, SemanticTreeBuilder b) {
        if (ctx.and_test().size() == 1) {
            return b.expression(ctx.and_test(0));
        }
        List<Expression> values = new ArrayList<>();
        for (PythonParser.And_testContext operand : ctx.and_test()) {
            values.add(b.expression(operand));
        }
        return new BoolOp(BoolOperator.OR, values);
    }

    public static Expression v(PythonParser.And_testContext ctx, SemanticTreeBuilder b) {
        if (ctx.not_test().size() == 1) {
            return b.expression(ctx.not_test(0));
        }
        List<Expression> values = new ArrayList<>();
        for (PythonParser.Not_testContext operand : ctx.not_test()) {
            values.add(b.expression(operand));
        }
        return new BoolOp(BoolOperator.AND, values);
    }

    public static Expression v(PythonParser.NotTestContext ctx, SemanticTreeBuilder b) {
        return new UnaryOp(UnaryOperator.NOT, b.expression(ctx.not_test()));
    }

    /**
     * A testlist with one element and no trailing comma is that element;
     * anything else is a tuple and stays raw.
     */
    public static Expression testlist(PythonParser.TestlistContext ctx, SemanticTreeBuilder b) {
        if (ctx.test().size() == 1 && ctx.getChildCount() == 1) {
            return b.expression(ctx.test(0));
        }
        return b.raw(ctx);
    }
}
