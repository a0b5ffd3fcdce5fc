package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.Module;
import me.christianrobert.convertifier.translator.semantic.statement.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for the module root and for statement blocks.
 *
 * <p>A {@code stmt} may hold several simple statements separated by {@code ;},
 * so statements are always collected into lists rather than returned one by one.
 */
public class VisitFileInput {

    public static Module v(PythonParser.File_inputContext ctx, SemanticTreeBuilder b) {
        List<Statement> body = new ArrayList<>();
        for (PythonParser.StmtContext stmtCtx : ctx.stmt()) {
            body.addAll(statements(stmtCtx, b));
        }
        return new Module(body);
    }

    /**
     * Statements of an indented block or of a one-line suite ({@code if x: y = 1}).
     */
    public static List<Statement> block(PythonParser.BlockContext ctx, SemanticTreeBuilder b) {
        List<Statement> body = new ArrayList<>();
        if (ctx == null) {
            return body;
        }
        if (ctx.simple_stmts() != null) {
            body.addAll(simpleStatements(ctx.simple_stmts(), b));
            return body;
        }
        for (PythonParser.StmtContext stmtCtx : ctx.stmt()) {
            body.addAll(statements(stmtCtx, b));
        }
        return body;
    }

    static List<Statement> statements(PythonParser.StmtContext ctx, SemanticTreeBuilder b) {
        if (ctx.simple_stmts() != null) {
            return simpleStatements(ctx.simple_stmts(), b);
        }
        return List.of(b.statement(ctx.compound_stmt()));
    }

    private static List<Statement> simpleStatements(PythonParser.Simple_stmtsContext ctx, SemanticTreeBuilder b) {
        List<Statement> statements = new ArrayList<>();
        for (PythonParser.Simple_stmtContext simpleCtx : ctx.simple_stmt()) {
            statements.add(b.statement(simpleCtx));
        }
        return statements;
    }
}
