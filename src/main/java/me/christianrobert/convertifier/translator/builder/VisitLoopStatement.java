package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.statement.For;
import me.christianrobert.convertifier.translator.semantic.statement.Statement;
import me.christianrobert.convertifier.translator.semantic.statement.While;

import java.util.List;

/**
 * Static helper for while and for loops, including their rarely used else blocks.
 */
public class VisitLoopStatement {

    public static While v(PythonParser.While_stmtContext ctx, SemanticTreeBuilder b) {
        List<Statement> body = VisitFileInput.block(ctx.block(0), b);
        List<Statement> orElse = ctx.block().size() > 1 ? VisitFileInput.block(ctx.block(1), b) : List.of();
        return new While(b.expression(ctx.test()), body, orElse, b.firstLine(ctx));
    }

    public static For v(PythonParser.For_stmtContext ctx, SemanticTreeBuilder b) {
        Expression target = exprlist(ctx.exprlist(), b);
        Expression iter = VisitTest.testlist(ctx.testlist(), b);
        List<Statement> body = VisitFileInput.block(ctx.block(0), b);
        List<Statement> orElse = ctx.block().size() > 1 ? VisitFileInput.block(ctx.block(1), b) : List.of();
        return new For(target, iter, body, orElse, b.firstLine(ctx));
    }

    /**
     * Loop target: a single name stays an expression, tuple unpacking stays raw.
     */
    static Expression exprlist(PythonParser.ExprlistContext ctx, SemanticTreeBuilder b) {
        if (ctx.expr().size() == 1 && ctx.getChildCount() == 1) {
            return b.expression(ctx.expr(0));
        }
        return b.raw(ctx);
    }
}
