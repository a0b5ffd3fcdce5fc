package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.Compare;
import me.christianrobert.convertifier.translator.semantic.expression.ComparisonOperator;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for comparison chains ({@code a < b <= c}).
 * Chains are kept flat; no re-association into {@code a < b and b <= c}.
 */
public class VisitComparison {

    public static Expression v(PythonParser.ComparisonContext ctx, SemanticTreeBuilder b) {
        List<PythonParser.ExprContext> operands = ctx.expr();
        if (operands.size() == 1) {
            return b.expression(operands.get(0));
        }

        List<ComparisonOperator> operators = new ArrayList<>();
        for (PythonParser.Comp_opContext opCtx : ctx.comp_op()) {
            operators.add(ComparisonOperator.fromPythonSymbol(operatorText(opCtx)));
        }

        List<Expression> comparators = new ArrayList<>();
        for (int i = 1; i < operands.size(); i++) {
            comparators.add(b.expression(operands.get(i)));
        }

        return new Compare(b.expression(operands.get(0)), operators, comparators);
    }

    // getText() would glue "is not" into "isnot"
    private static String operatorText(PythonParser.Comp_opContext ctx) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(child.getText());
        }
        return text.toString();
    }
}
