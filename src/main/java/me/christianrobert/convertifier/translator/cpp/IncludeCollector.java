package me.christianrobert.convertifier.translator.cpp;

import me.christianrobert.convertifier.translator.semantic.expression.Attribute;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOp;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOperator;
import me.christianrobert.convertifier.translator.semantic.expression.BoolOp;
import me.christianrobert.convertifier.translator.semantic.expression.Call;
import me.christianrobert.convertifier.translator.semantic.expression.Compare;
import me.christianrobert.convertifier.translator.semantic.expression.Conditional;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.ExpressionVisitor;
import me.christianrobert.convertifier.translator.semantic.expression.ListDisplay;
import me.christianrobert.convertifier.translator.semantic.expression.Literal;
import me.christianrobert.convertifier.translator.semantic.expression.Name;
import me.christianrobert.convertifier.translator.semantic.expression.RawExpression;
import me.christianrobert.convertifier.translator.semantic.expression.Subscript;
import me.christianrobert.convertifier.translator.semantic.expression.UnaryOp;
import me.christianrobert.convertifier.translator.semantic.statement.Assign;
import me.christianrobert.convertifier.translator.semantic.statement.AugAssign;
import me.christianrobert.convertifier.translator.semantic.statement.ExprStatement;
import me.christianrobert.convertifier.translator.semantic.statement.For;
import me.christianrobert.convertifier.translator.semantic.statement.FunctionDef;
import me.christianrobert.convertifier.translator.semantic.statement.If;
import me.christianrobert.convertifier.translator.semantic.statement.Import;
import me.christianrobert.convertifier.translator.semantic.statement.ImportFrom;
import me.christianrobert.convertifier.translator.semantic.statement.LoopControl;
import me.christianrobert.convertifier.translator.semantic.statement.Parameter;
import me.christianrobert.convertifier.translator.semantic.statement.Pass;
import me.christianrobert.convertifier.translator.semantic.statement.Return;
import me.christianrobert.convertifier.translator.semantic.statement.Statement;
import me.christianrobert.convertifier.translator.semantic.statement.StatementVisitor;
import me.christianrobert.convertifier.translator.semantic.statement.UnsupportedStatement;
import me.christianrobert.convertifier.translator.semantic.statement.While;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * First pass of the Python to C++ translation: collects the C++ headers the output needs.
 *
 * <p>Walks every statement, including function, branch and loop bodies, whether or not
 * the body pass renders them. Imported modules are mapped through {@link #MODULE_HEADERS};
 * {@code **} anywhere adds {@code <cmath>} because it renders as {@code std::pow}.
 * {@code <iostream>} and {@code <string>} are always present.
 *
 * <p>One collector per translation; the header table is shared and read-only.
 */
public class IncludeCollector implements StatementVisitor<Void>, ExpressionVisitor<Void> {

    public static final Map<String, String> MODULE_HEADERS = Map.of(
            "math", "cmath",
            "random", "random",
            "time", "ctime");

    public static final List<String> ALWAYS_INCLUDED = List.of("iostream", "string");

    private final Set<String> headers = new TreeSet<>(ALWAYS_INCLUDED);

    /**
     * Collects headers for the given statements and returns them sorted.
     */
    public Set<String> collect(List<Statement> statements) {
        statements(statements);
        return headers;
    }

    /**
     * Renders the collected headers as {@code #include <...>} lines in sorted order.
     */
    public List<String> includeLines() {
        return headers.stream().map(header -> "#include <" + header + ">").toList();
    }

    private void statements(List<Statement> statements) {
        for (Statement statement : statements) {
            statement.accept(this);
        }
    }

    private void expression(Expression expression) {
        if (expression != null) {
            expression.accept(this);
        }
    }

    private void module(String name) {
        String module = name.replaceFirst("^\\.+", "");
        int dot = module.indexOf('.');
        String topLevel = dot >= 0 ? module.substring(0, dot) : module;

        String header = MODULE_HEADERS.get(module);
        if (header == null) {
            header = MODULE_HEADERS.get(topLevel);
        }
        if (header != null) {
            headers.add(header);
        }
    }

    // ========== STATEMENTS ==========

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        for (Parameter parameter : node.getParameters()) {
            expression(parameter.getDefaultValue());
        }
        statements(node.getBody());
        return null;
    }

    @Override
    public Void visitAssign(Assign node) {
        node.getTargets().forEach(this::expression);
        expression(node.getValue());
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssign node) {
        if (node.getOperator() == BinaryOperator.POW) {
            headers.add("cmath");
        }
        expression(node.getTarget());
        expression(node.getValue());
        return null;
    }

    @Override
    public Void visitIf(If node) {
        for (If.Branch branch : node.getBranches()) {
            expression(branch.getTest());
            statements(branch.getBody());
        }
        statements(node.getOrElse());
        return null;
    }

    @Override
    public Void visitWhile(While node) {
        expression(node.getTest());
        statements(node.getBody());
        statements(node.getOrElse());
        return null;
    }

    @Override
    public Void visitFor(For node) {
        expression(node.getIter());
        statements(node.getBody());
        statements(node.getOrElse());
        return null;
    }

    @Override
    public Void visitReturn(Return node) {
        expression(node.getValue());
        return null;
    }

    @Override
    public Void visitExprStatement(ExprStatement node) {
        expression(node.getExpression());
        return null;
    }

    @Override
    public Void visitPass(Pass node) {
        return null;
    }

    @Override
    public Void visitLoopControl(LoopControl node) {
        return null;
    }

    @Override
    public Void visitImport(Import node) {
        node.getModules().forEach(this::module);
        return null;
    }

    @Override
    public Void visitImportFrom(ImportFrom node) {
        module(node.getModule());
        return null;
    }

    @Override
    public Void visitUnsupported(UnsupportedStatement node) {
        return null;
    }

    // ========== EXPRESSIONS ==========

    @Override
    public Void visitBinaryOp(BinaryOp node) {
        if (node.getOperator() == BinaryOperator.POW) {
            headers.add("cmath");
        }
        expression(node.getLeft());
        expression(node.getRight());
        return null;
    }

    @Override
    public Void visitCompare(Compare node) {
        expression(node.getLeft());
        node.getComparators().forEach(this::expression);
        return null;
    }

    @Override
    public Void visitBoolOp(BoolOp node) {
        node.getValues().forEach(this::expression);
        return null;
    }

    @Override
    public Void visitUnaryOp(UnaryOp node) {
        expression(node.getOperand());
        return null;
    }

    @Override
    public Void visitCall(Call node) {
        expression(node.getFunc());
        node.getArgs().forEach(this::expression);
        node.getKeywords().values().forEach(this::expression);
        return null;
    }

    @Override
    public Void visitAttribute(Attribute node) {
        expression(node.getValue());
        return null;
    }

    @Override
    public Void visitSubscript(Subscript node) {
        expression(node.getValue());
        expression(node.getIndex());
        return null;
    }

    @Override
    public Void visitListDisplay(ListDisplay node) {
        node.getElements().forEach(this::expression);
        return null;
    }

    @Override
    public Void visitConditional(Conditional node) {
        expression(node.getTest());
        expression(node.getBody());
        expression(node.getOrElse());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node) {
        return null;
    }

    @Override
    public Void visitName(Name node) {
        return null;
    }

    @Override
    public Void visitRawExpression(RawExpression node) {
        return null;
    }
}
