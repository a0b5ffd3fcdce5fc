package me.christianrobert.convertifier.translator.cpp;

import me.christianrobert.convertifier.translator.context.TranslatorOptions;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOperator;
import me.christianrobert.convertifier.translator.semantic.expression.Call;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.Name;
import me.christianrobert.convertifier.translator.semantic.expression.UnaryOp;
import me.christianrobert.convertifier.translator.semantic.expression.UnaryOperator;
import me.christianrobert.convertifier.translator.semantic.statement.Assign;
import me.christianrobert.convertifier.translator.semantic.statement.AugAssign;
import me.christianrobert.convertifier.translator.semantic.statement.CompoundStatement;
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

import java.util.ArrayList;
import java.util.List;

/**
 * Body pass of the Python to C++ translation: renders statements as unindented C++ lines.
 * Indentation is left to the formatter.
 *
 * <p>Scopes:
 * <ul>
 *   <li>module level: assignments declare ({@code auto x = 1;})</li>
 *   <li>function body: assignments assign ({@code x = 1;}); if/while/for are walked</li>
 *   <li>branch or loop body: walked one level only; a nested if, while, for or def
 *       becomes a {@code // unsupported nested block: ...} comment</li>
 * </ul>
 *
 * <p>An elif chain is not nesting and renders as {@code else if}.
 */
public class StatementEmitter implements StatementVisitor<Void> {

    static final String NESTED_BLOCK_COMMENT = "// unsupported nested block: ";

    private enum Scope {
        MODULE,
        FUNCTION,
        BRANCH
    }

    private final CppExpressionTranslator expressions;
    private final TranslatorOptions options;
    private final List<String> lines = new ArrayList<>();
    private Scope scope = Scope.MODULE;

    public StatementEmitter(CppExpressionTranslator expressions, TranslatorOptions options) {
        this.expressions = expressions;
        this.options = options != null ? options : TranslatorOptions.defaults();
    }

    /**
     * Emits top-level statements and returns all lines emitted so far.
     */
    public List<String> emitModule(List<Statement> statements) {
        for (Statement statement : statements) {
            statement.accept(this);
        }
        return lines;
    }

    // ========== DEFINITIONS ==========

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        if (scope != Scope.MODULE) {
            return nestedBlock(node);
        }

        String returnType = node.getReturns() != null ? CppTypeMapper.toCpp(node.getReturns()) : null;
        List<String> parameters = new ArrayList<>();
        for (Parameter parameter : node.getParameters()) {
            parameters.add(parameter(parameter));
        }

        line((returnType != null ? returnType : "void") + " " + node.getName()
                + "(" + String.join(", ", parameters) + ") {");
        body(node.getBody(), Scope.FUNCTION);
        line("}");
        blank();
        return null;
    }

    private String parameter(Parameter parameter) {
        String type = parameter.hasAnnotation() ? CppTypeMapper.toCpp(parameter.getAnnotation()) : null;
        if (type == null) {
            type = options.getDefaultParameterType();
        }

        switch (parameter.getKind()) {
            case VAR_POSITIONAL:
            case VAR_KEYWORD:
                return type + "... " + parameter.getName();
            default:
                if (parameter.getDefaultValue() != null) {
                    return type + " " + parameter.getName() + " = " + expressions.translate(parameter.getDefaultValue());
                }
                return type + " " + parameter.getName();
        }
    }

    // ========== SIMPLE STATEMENTS ==========

    @Override
    public Void visitAssign(Assign node) {
        String declaredType = node.getAnnotation() != null ? CppTypeMapper.toCpp(node.getAnnotation()) : null;
        if (declaredType == null && (scope == Scope.MODULE || !node.hasValue())) {
            declaredType = "auto";
        }

        for (Expression target : node.getTargets()) {
            String prefix = declaredType != null ? declaredType + " " : "";
            if (node.hasValue()) {
                line(prefix + expressions.translate(target) + " = " + expressions.translate(node.getValue()) + ";");
            } else {
                line(prefix + expressions.translate(target) + ";");
            }
        }
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssign node) {
        String target = expressions.translate(node.getTarget());
        String value = expressions.translate(node.getValue());

        if (node.getOperator() == BinaryOperator.POW) {
            line(target + " = std::pow(" + target + ", " + value + ");");
        } else {
            String symbol = node.getOperator().getCppSymbol() != null
                    ? node.getOperator().getCppSymbol()
                    : node.getOperator().getPythonSymbol();
            line(target + " " + symbol + "= " + value + ";");
        }
        return null;
    }

    @Override
    public Void visitReturn(Return node) {
        line(node.hasValue() ? "return " + expressions.translate(node.getValue()) + ";" : "return;");
        return null;
    }

    @Override
    public Void visitExprStatement(ExprStatement node) {
        line(expressions.translate(node.getExpression()) + ";");
        return null;
    }

    @Override
    public Void visitPass(Pass node) {
        return null;
    }

    @Override
    public Void visitLoopControl(LoopControl node) {
        line(node.getKind().getKeyword() + ";");
        return null;
    }

    @Override
    public Void visitImport(Import node) {
        // Imports only affect the include block
        return null;
    }

    @Override
    public Void visitImportFrom(ImportFrom node) {
        return null;
    }

    @Override
    public Void visitUnsupported(UnsupportedStatement node) {
        for (String sourceLine : node.getSourceLines()) {
            line("// " + sourceLine.trim());
        }
        return null;
    }

    // ========== BLOCKS ==========

    @Override
    public Void visitIf(If node) {
        if (scope == Scope.BRANCH) {
            return nestedBlock(node);
        }

        List<If.Branch> branches = node.getBranches();
        for (int i = 0; i < branches.size(); i++) {
            If.Branch branch = branches.get(i);
            String keyword = i == 0 ? "if " : "} else if ";
            line(keyword + expressions.condition(branch.getTest()) + " {");
            body(branch.getBody(), Scope.BRANCH);
        }
        if (node.hasElse()) {
            line("} else {");
            body(node.getOrElse(), Scope.BRANCH);
        }
        line("}");
        return null;
    }

    @Override
    public Void visitWhile(While node) {
        if (scope == Scope.BRANCH) {
            return nestedBlock(node);
        }

        line("while " + expressions.condition(node.getTest()) + " {");
        body(node.getBody(), Scope.BRANCH);
        line("}");
        loopElse(node.getOrElse());
        return null;
    }

    @Override
    public Void visitFor(For node) {
        if (scope == Scope.BRANCH) {
            return nestedBlock(node);
        }

        line(forHeader(node));
        body(node.getBody(), Scope.BRANCH);
        line("}");
        loopElse(node.getOrElse());
        return null;
    }

    /**
     * Counting loop for {@code range(...)} over a plain name, range-based for otherwise.
     * A negative literal step counts down.
     */
    private String forHeader(For node) {
        String target = expressions.translate(node.getTarget());

        if (node.getTarget() instanceof Name && node.getIter() instanceof Call) {
            Call call = (Call) node.getIter();
            List<Expression> args = call.getArgs();
            if (call.isBuiltin("range") && call.getKeywords().isEmpty() && !args.isEmpty() && args.size() <= 3) {
                String start = args.size() == 1 ? "0" : expressions.translate(args.get(0));
                String stop = expressions.translate(args.size() == 1 ? args.get(0) : args.get(1));

                String comparison = " < ";
                String step = target + "++";
                if (args.size() == 3) {
                    Expression stepExpr = args.get(2);
                    if (isNegative(stepExpr)) {
                        comparison = " > ";
                    }
                    step = target + " += " + expressions.translate(stepExpr);
                }
                return "for (int " + target + " = " + start + "; " + target + comparison + stop + "; " + step + ") {";
            }
        }

        return "for (auto " + target + " : " + expressions.translate(node.getIter()) + ") {";
    }

    private static boolean isNegative(Expression expression) {
        return expression instanceof UnaryOp && ((UnaryOp) expression).getOperator() == UnaryOperator.USUB;
    }

    private void loopElse(List<Statement> orElse) {
        if (!orElse.isEmpty()) {
            line("// unsupported loop else block");
        }
    }

    private Void nestedBlock(CompoundStatement node) {
        line(NESTED_BLOCK_COMMENT + node.getHeaderLine());
        return null;
    }

    private void body(List<Statement> statements, Scope bodyScope) {
        Scope outer = scope;
        scope = bodyScope;
        try {
            for (Statement statement : statements) {
                statement.accept(this);
            }
        } finally {
            scope = outer;
        }
    }

    private void line(String text) {
        lines.add(text);
    }

    // Never two blank lines in a row
    private void blank() {
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
    }
}
