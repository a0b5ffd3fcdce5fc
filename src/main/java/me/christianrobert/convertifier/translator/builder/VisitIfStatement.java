package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.statement.If;
import me.christianrobert.convertifier.translator.semantic.statement.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for if/elif/else.
 *
 * <p>Grammar: {@code 'if' test ':' block ('elif' test ':' block)* ('else' ':' block)?}.
 * Block {@code i} belongs to test {@code i}; a block without a test is the else block.
 */
public class VisitIfStatement {

    public static If v(PythonParser.If_stmtContext ctx, SemanticTreeBuilder b) {
        List<PythonParser.TestContext> tests = ctx.test();
        List<PythonParser.BlockContext> blocks = ctx.block();

        List<If.Branch> branches = new ArrayList<>();
        for (int i = 0; i < tests.size(); i++) {
            branches.add(new If.Branch(b.expression(tests.get(i)), VisitFileInput.block(blocks.get(i), b)));
        }

        List<Statement> orElse = List.of();
        if (blocks.size() > tests.size()) {
            orElse = VisitFileInput.block(blocks.get(blocks.size() - 1), b);
        }

        return new If(branches, orElse, b.firstLine(ctx));
    }
}
