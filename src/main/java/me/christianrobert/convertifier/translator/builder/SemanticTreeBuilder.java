package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonBaseVisitor;
import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.context.TranslationException;
import me.christianrobert.convertifier.translator.semantic.PyNode;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.Literal;
import me.christianrobert.convertifier.translator.semantic.expression.Name;
import me.christianrobert.convertifier.translator.semantic.expression.RawExpression;
import me.christianrobert.convertifier.translator.semantic.statement.ExprStatement;
import me.christianrobert.convertifier.translator.semantic.statement.LoopControl;
import me.christianrobert.convertifier.translator.semantic.statement.Pass;
import me.christianrobert.convertifier.translator.semantic.statement.Return;
import me.christianrobert.convertifier.translator.semantic.statement.Statement;
import me.christianrobert.convertifier.translator.semantic.statement.UnsupportedStatement;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Visitor that converts the ANTLR parse tree to the Python semantic tree.
 * Together with the {@code Visit*} helpers in this package, this is the only code
 * that touches ANTLR parse contexts.
 *
 * <p>Each visit method returns a freshly built node; rule-specific logic lives in a
 * static helper ({@code VisitIfStatement.v(ctx, this)}) and recurses back through
 * {@link #visit(ParseTree)}.
 *
 * <p>Constructs outside the translated subset never fail the build: statements become
 * {@link UnsupportedStatement} and expressions become {@link RawExpression}, both
 * carrying the original source text.
 */
public class SemanticTreeBuilder extends PythonBaseVisitor<PyNode> {

    private static final Logger log = LoggerFactory.getLogger(SemanticTreeBuilder.class);

    // ========== MODULE AND BLOCKS ==========

    @Override
    public PyNode visitFile_input(PythonParser.File_inputContext ctx) {
        log.debug("Visiting file_input");
        return VisitFileInput.v(ctx, this);
    }

    @Override
    public PyNode visitCompound_stmt(PythonParser.Compound_stmtContext ctx) {
        return visit(ctx.getChild(0));
    }

    // ========== SIMPLE STATEMENTS ==========

    @Override
    public PyNode visitAssignStmt(PythonParser.AssignStmtContext ctx) {
        return VisitAssignment.v(ctx, this);
    }

    @Override
    public PyNode visitAugAssignStmt(PythonParser.AugAssignStmtContext ctx) {
        return VisitAssignment.v(ctx, this);
    }

    @Override
    public PyNode visitAnnAssignStmt(PythonParser.AnnAssignStmtContext ctx) {
        return VisitAssignment.v(ctx, this);
    }

    @Override
    public PyNode visitExprStmt(PythonParser.ExprStmtContext ctx) {
        return new ExprStatement(VisitTest.testlist(ctx.testlist(), this));
    }

    @Override
    public PyNode visitYieldStmt(PythonParser.YieldStmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitYieldAssignStmt(PythonParser.YieldAssignStmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitPassStmt(PythonParser.PassStmtContext ctx) {
        return new Pass();
    }

    @Override
    public PyNode visitBreakStmt(PythonParser.BreakStmtContext ctx) {
        return new LoopControl(LoopControl.Kind.BREAK);
    }

    @Override
    public PyNode visitContinueStmt(PythonParser.ContinueStmtContext ctx) {
        return new LoopControl(LoopControl.Kind.CONTINUE);
    }

    @Override
    public PyNode visitReturnStmt(PythonParser.ReturnStmtContext ctx) {
        if (ctx.testlist() == null) {
            return new Return(null);
        }
        return new Return(VisitTest.testlist(ctx.testlist(), this));
    }

    @Override
    public PyNode visitImportStmt(PythonParser.ImportStmtContext ctx) {
        return VisitImport.v(ctx, this);
    }

    @Override
    public PyNode visitImportFromStmt(PythonParser.ImportFromStmtContext ctx) {
        return VisitImport.v(ctx, this);
    }

    @Override
    public PyNode visitRaiseStmt(PythonParser.RaiseStmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitGlobalStmt(PythonParser.GlobalStmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitNonlocalStmt(PythonParser.NonlocalStmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitDelStmt(PythonParser.DelStmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitAssertStmt(PythonParser.AssertStmtContext ctx) {
        return unsupported(ctx);
    }

    // ========== COMPOUND STATEMENTS ==========

    @Override
    public PyNode visitIf_stmt(PythonParser.If_stmtContext ctx) {
        return VisitIfStatement.v(ctx, this);
    }

    @Override
    public PyNode visitWhile_stmt(PythonParser.While_stmtContext ctx) {
        return VisitLoopStatement.v(ctx, this);
    }

    @Override
    public PyNode visitFor_stmt(PythonParser.For_stmtContext ctx) {
        return VisitLoopStatement.v(ctx, this);
    }

    @Override
    public PyNode visitFuncdef(PythonParser.FuncdefContext ctx) {
        return VisitFuncdef.v(ctx, this);
    }

    @Override
    public PyNode visitClassdef(PythonParser.ClassdefContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitTry_stmt(PythonParser.Try_stmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitWith_stmt(PythonParser.With_stmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitDecorated(PythonParser.DecoratedContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitAsync_stmt(PythonParser.Async_stmtContext ctx) {
        return unsupported(ctx);
    }

    @Override
    public PyNode visitMatch_stmt(PythonParser.Match_stmtContext ctx) {
        return unsupported(ctx);
    }

    // ========== EXPRESSION HIERARCHY ==========

    @Override
    public PyNode visitConditionalTest(PythonParser.ConditionalTestContext ctx) {
        return VisitTest.v(ctx, this);
    }

    @Override
    public PyNode visitLambdaTest(PythonParser.LambdaTestContext ctx) {
        return raw(ctx);
    }

    @Override
    public PyNode visitNamedExprTest(PythonParser.NamedExprTestContext ctx) {
        return raw(ctx);
    }

    @Override
    public PyNode visitOr_test(PythonParser.Or_testContext ctx) {
        return VisitTest.v(ctx, this);
    }

    @Override
    public PyNode visitAnd_test(PythonParser.And_testContext ctx) {
        return VisitTest.v(ctx, this);
    }

    @Override
    public PyNode visitNotTest(PythonParser.NotTestContext ctx) {
        return VisitTest.v(ctx, this);
    }

    @Override
    public PyNode visitComparisonTest(PythonParser.ComparisonTestContext ctx) {
        return visit(ctx.comparison());
    }

    @Override
    public PyNode visitComparison(PythonParser.ComparisonContext ctx) {
        return VisitComparison.v(ctx, this);
    }

    @Override
    public PyNode visitExpr(PythonParser.ExprContext ctx) {
        return VisitBinaryExpression.v(ctx, this);
    }

    @Override
    public PyNode visitXor_expr(PythonParser.Xor_exprContext ctx) {
        return VisitBinaryExpression.v(ctx, this);
    }

    @Override
    public PyNode visitAnd_expr(PythonParser.And_exprContext ctx) {
        return VisitBinaryExpression.v(ctx, this);
    }

    @Override
    public PyNode visitShift_expr(PythonParser.Shift_exprContext ctx) {
        return VisitBinaryExpression.v(ctx, this);
    }

    @Override
    public PyNode visitArith_expr(PythonParser.Arith_exprContext ctx) {
        return VisitBinaryExpression.v(ctx, this);
    }

    @Override
    public PyNode visitTerm(PythonParser.TermContext ctx) {
        return VisitBinaryExpression.v(ctx, this);
    }

    @Override
    public PyNode visitUnaryFactor(PythonParser.UnaryFactorContext ctx) {
        return VisitFactor.v(ctx, this);
    }

    @Override
    public PyNode visitPowerFactor(PythonParser.PowerFactorContext ctx) {
        return visit(ctx.power());
    }

    @Override
    public PyNode visitPower(PythonParser.PowerContext ctx) {
        return VisitFactor.v(ctx, this);
    }

    @Override
    public PyNode visitAtom_expr(PythonParser.Atom_exprContext ctx) {
        return VisitAtomExpr.v(ctx, this);
    }

    @Override
    public PyNode visitStar_expr(PythonParser.Star_exprContext ctx) {
        return raw(ctx);
    }

    // ========== ATOMS ==========

    @Override
    public PyNode visitParenAtom(PythonParser.ParenAtomContext ctx) {
        return VisitAtom.v(ctx, this);
    }

    @Override
    public PyNode visitListAtom(PythonParser.ListAtomContext ctx) {
        return VisitAtom.v(ctx, this);
    }

    @Override
    public PyNode visitDictAtom(PythonParser.DictAtomContext ctx) {
        return raw(ctx);
    }

    @Override
    public PyNode visitNameAtom(PythonParser.NameAtomContext ctx) {
        return new Name(ctx.NAME().getText());
    }

    @Override
    public PyNode visitNumberAtom(PythonParser.NumberAtomContext ctx) {
        return Literal.number(ctx.NUMBER().getText());
    }

    @Override
    public PyNode visitStringAtom(PythonParser.StringAtomContext ctx) {
        return VisitStringLiteral.v(ctx, this);
    }

    @Override
    public PyNode visitEllipsisAtom(PythonParser.EllipsisAtomContext ctx) {
        return raw(ctx);
    }

    @Override
    public PyNode visitNoneAtom(PythonParser.NoneAtomContext ctx) {
        return Literal.none();
    }

    @Override
    public PyNode visitTrueAtom(PythonParser.TrueAtomContext ctx) {
        return Literal.bool(true);
    }

    @Override
    public PyNode visitFalseAtom(PythonParser.FalseAtomContext ctx) {
        return Literal.bool(false);
    }

    // ========== SHARED HELPERS ==========

    /**
     * Visits a context that must produce an expression.
     */
    public Expression expression(ParserRuleContext ctx) {
        if (ctx == null) {
            throw new TranslationException("Expected an expression but found nothing");
        }
        PyNode node = visit(ctx);
        if (!(node instanceof Expression)) {
            throw new TranslationException("Expected an expression but got "
                    + (node == null ? "nothing" : node.getClass().getSimpleName()) + " for: " + sourceText(ctx));
        }
        return (Expression) node;
    }

    /**
     * Visits a context that must produce a statement.
     */
    public Statement statement(ParseTree tree) {
        PyNode node = visit(tree);
        if (!(node instanceof Statement)) {
            throw new TranslationException("Expected a statement but got "
                    + (node == null ? "nothing" : node.getClass().getSimpleName()) + " for: " + tree.getText());
        }
        return (Statement) node;
    }

    /**
     * Wraps the original source of a context that is outside the translated subset.
     */
    public RawExpression raw(ParserRuleContext ctx) {
        return new RawExpression(sourceText(ctx));
    }

    private UnsupportedStatement unsupported(ParserRuleContext ctx) {
        String keyword = ctx.getStart() != null ? ctx.getStart().getText() : "";
        return new UnsupportedStatement(keyword, sourceText(ctx));
    }

    /**
     * Original source text of a context, including whitespace and comments between its tokens.
     * Trailing whitespace picked up from NEWLINE/DEDENT tokens is removed.
     */
    public String sourceText(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (start == null || stop == null || start.getInputStream() == null
                || stop.getStopIndex() < start.getStartIndex()) {
            return ctx.getText();
        }
        String text = start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
        return text.stripTrailing();
    }

    /**
     * First physical line of a context's source text.
     */
    public String firstLine(ParserRuleContext ctx) {
        String text = sourceText(ctx);
        int newline = text.indexOf('\n');
        String line = newline >= 0 ? text.substring(0, newline) : text;
        return line.replace("\r", "").trim();
    }
}
