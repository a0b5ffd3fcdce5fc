package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.translator.context.TranslationException;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOp;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOperator;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * Static helper for the layered binary rules (expr, xor_expr, and_expr, shift_expr,
 * arith_expr, term). All of them have the shape {@code operand (OP operand)*}:
 * operands at even child positions, operator tokens at odd ones.
 *
 * <p>Builds a left-associative tree: {@code a - b - c} becomes {@code (a - b) - c}.
 */
public class VisitBinaryExpression {

    public static Expression v(ParserRuleContext ctx, SemanticTreeBuilder b) {
        int count = ctx.getChildCount();
        if (count % 2 == 0) {
            throw new TranslationException("Malformed binary expression: " + ctx.getText());
        }

        Expression result = b.expression((ParserRuleContext) ctx.getChild(0));
        for (int i = 1; i < count; i += 2) {
            ParseTree operatorNode = ctx.getChild(i);
            BinaryOperator operator = BinaryOperator.fromPythonSymbol(operatorNode.getText());
            Expression right = b.expression((ParserRuleContext) ctx.getChild(i + 1));
            result = new BinaryOp(result, operator, right);
        }
        return result;
    }
}
