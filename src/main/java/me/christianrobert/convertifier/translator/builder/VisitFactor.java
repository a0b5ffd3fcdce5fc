package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOp;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOperator;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.UnaryOp;
import me.christianrobert.convertifier.translator.semantic.expression.UnaryOperator;

/**
 * Static helper for unary arithmetic operators and the power operator.
 * {@code -x ** 2} parses as {@code -(x ** 2)}; {@code **} is right-associative.
 * An awaited operand stays raw.
 */
public class VisitFactor {

    public static Expression v(PythonParser.UnaryFactorContext ctx, SemanticTreeBuilder b) {
        UnaryOperator operator = UnaryOperator.fromPythonSymbol(ctx.getChild(0).getText());
        return new UnaryOp(operator, b.expression(ctx.factor()));
    }

    public static Expression v(PythonParser.PowerContext ctx, SemanticTreeBuilder b) {
        if (ctx.AWAIT() != null) {
            return b.raw(ctx);
        }
        Expression base = b.expression(ctx.atom_expr());
        if (ctx.factor() == null) {
            return base;
        }
        return new BinaryOp(base, BinaryOperator.POW, b.expression(ctx.factor()));
    }
}
