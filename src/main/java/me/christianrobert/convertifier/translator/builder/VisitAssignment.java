package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOperator;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.statement.Assign;
import me.christianrobert.convertifier.translator.semantic.statement.AugAssign;
import me.christianrobert.convertifier.translator.semantic.statement.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for plain, augmented and annotated assignments.
 *
 * <pre>
 * a = b = value        Assign(targets=[a, b], value)
 * total += x           AugAssign(total, ADD, x)
 * count: int = 0       Assign(targets=[count], value=0, annotation=int)
 * </pre>
 */
public class VisitAssignment {

    public static Statement v(PythonParser.AssignStmtContext ctx, SemanticTreeBuilder b) {
        List<PythonParser.TestlistContext> parts = ctx.testlist();

        // Last testlist is the value, every one before it is a target
        List<Expression> targets = new ArrayList<>();
        for (int i = 0; i < parts.size() - 1; i++) {
            targets.add(VisitTest.testlist(parts.get(i), b));
        }
        Expression value = VisitTest.testlist(parts.get(parts.size() - 1), b);
        return new Assign(targets, value);
    }

    public static Statement v(PythonParser.AugAssignStmtContext ctx, SemanticTreeBuilder b) {
        String symbol = ctx.augassign().getText();
        BinaryOperator operator = BinaryOperator.fromPythonSymbol(symbol.substring(0, symbol.length() - 1));
        return new AugAssign(b.expression(ctx.test()), operator, VisitTest.testlist(ctx.testlist(), b));
    }

    public static Statement v(PythonParser.AnnAssignStmtContext ctx, SemanticTreeBuilder b) {
        Expression target = b.expression(ctx.test(0));
        Expression annotation = b.expression(ctx.test(1));
        Expression value = ctx.testlist() != null ? VisitTest.testlist(ctx.testlist(), b) : null;
        return new Assign(List.of(target), value, annotation);
    }
}
