package me.christianrobert.convertifier.translator.cpp;

import me.christianrobert.convertifier.translator.context.TranslatorOptions;
import me.christianrobert.convertifier.translator.semantic.expression.Attribute;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOp;
import me.christianrobert.convertifier.translator.semantic.expression.BinaryOperator;
import me.christianrobert.convertifier.translator.semantic.expression.BoolOp;
import me.christianrobert.convertifier.translator.semantic.expression.Call;
import me.christianrobert.convertifier.translator.semantic.expression.Compare;
import me.christianrobert.convertifier.translator.semantic.expression.ComparisonOperator;
import me.christianrobert.convertifier.translator.semantic.expression.Conditional;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.ExpressionVisitor;
import me.christianrobert.convertifier.translator.semantic.expression.ListDisplay;
import me.christianrobert.convertifier.translator.semantic.expression.Literal;
import me.christianrobert.convertifier.translator.semantic.expression.Name;
import me.christianrobert.convertifier.translator.semantic.expression.RawExpression;
import me.christianrobert.convertifier.translator.semantic.expression.Subscript;
import me.christianrobert.convertifier.translator.semantic.expression.UnaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders Python expressions as C++ expression text.
 *
 * <p>Compound expressions are parenthesised to keep Python evaluation order:
 * {@code a + b * c} becomes {@code (a + (b * c))}.
 *
 * <p>Builtin calls with a C++ stream idiom:
 * <pre>
 * print(a, b)          std::cout << a << b << std::endl
 * print(a, end="")     std::cout << a
 * input(x)             std::cin >> x
 * input()              std::cin >> input_var
 * </pre>
 *
 * <p>If rendering one expression fails, the failure is logged and that expression
 * is replaced by its textual form; the surrounding translation goes on.
 */
public class CppExpressionTranslator implements ExpressionVisitor<String> {

    private static final Logger log = LoggerFactory.getLogger(CppExpressionTranslator.class);

    private static final String OUTPUT_STREAM = "std::cout";
    private static final String INPUT_STREAM = "std::cin";
    private static final String LINE_END = "std::endl";

    private final TranslatorOptions options;

    public CppExpressionTranslator(TranslatorOptions options) {
        this.options = options != null ? options : TranslatorOptions.defaults();
    }

    public CppExpressionTranslator() {
        this(TranslatorOptions.defaults());
    }

    /**
     * Translates one expression. Never throws.
     */
    public String translate(Expression expression) {
        if (expression == null) {
            return "";
        }
        try {
            return expression.accept(this);
        } catch (RuntimeException e) {
            log.warn("Could not translate expression {}, using its textual form", expression, e);
            return expression.toString();
        }
    }

    /**
     * Translates an expression used as an if/while condition: exactly one pair of
     * parentheses around it, so {@code x > 0} and {@code flag} both come out ready
     * for {@code if (...)}.
     */
    public String condition(Expression expression) {
        String text = translate(expression);
        return isWrapped(text) ? text : "(" + text + ")";
    }

    // ========== LEAVES ==========

    @Override
    public String visitLiteral(Literal node) {
        switch (node.getKind()) {
            case STRING:
                return quote(node.getValue());
            case BOOLEAN:
                return "True".equals(node.getValue()) ? "true" : "false";
            case NONE:
                return "nullptr";
            default:
                return node.getValue();
        }
    }

    @Override
    public String visitName(Name node) {
        return node.getId();
    }

    @Override
    public String visitRawExpression(RawExpression node) {
        return node.getSourceText();
    }

    // ========== OPERATORS ==========

    @Override
    public String visitBinaryOp(BinaryOp node) {
        String left = translate(node.getLeft());
        String right = translate(node.getRight());
        if (node.getOperator() == BinaryOperator.POW) {
            return "std::pow(" + left + ", " + right + ")";
        }
        return "(" + left + " " + cppSymbol(node.getOperator()) + " " + right + ")";
    }

    @Override
    public String visitCompare(Compare node) {
        StringBuilder result = new StringBuilder("(");
        result.append(translate(node.getLeft()));
        for (int i = 0; i < node.getOperators().size(); i++) {
            ComparisonOperator operator = node.getOperators().get(i);
            String symbol = operator.getCppSymbol() != null ? operator.getCppSymbol() : operator.getPythonSymbol();
            result.append(' ').append(symbol).append(' ').append(translate(node.getComparators().get(i)));
        }
        return result.append(')').toString();
    }

    @Override
    public String visitBoolOp(BoolOp node) {
        List<String> parts = new ArrayList<>();
        for (Expression value : node.getValues()) {
            parts.add(translate(value));
        }
        return "(" + String.join(" " + node.getOperator().getCppSymbol() + " ", parts) + ")";
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        String operand = translate(node.getOperand());
        String symbol = node.getOperator().getCppSymbol();
        if (isAtomic(node.getOperand())) {
            return symbol + operand;
        }
        return symbol + "(" + operand + ")";
    }

    @Override
    public String visitConditional(Conditional node) {
        return "(" + translate(node.getTest()) + " ? " + translate(node.getBody())
                + " : " + translate(node.getOrElse()) + ")";
    }

    // ========== CALLS AND ACCESS ==========

    @Override
    public String visitCall(Call node) {
        if (node.isBuiltin("print")) {
            return printCall(node);
        }
        if (node.isBuiltin("input")) {
            return inputCall(node);
        }

        List<String> args = new ArrayList<>();
        for (Expression arg : node.getArgs()) {
            args.add(translate(arg));
        }
        return translate(node.getFunc()) + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visitAttribute(Attribute node) {
        return translate(node.getValue()) + "." + node.getAttr();
    }

    @Override
    public String visitSubscript(Subscript node) {
        return translate(node.getValue()) + "[" + translate(node.getIndex()) + "]";
    }

    @Override
    public String visitListDisplay(ListDisplay node) {
        List<String> elements = new ArrayList<>();
        for (Expression element : node.getElements()) {
            elements.add(translate(element));
        }
        return "{" + String.join(", ", elements) + "}";
    }

    private String printCall(Call node) {
        StringBuilder result = new StringBuilder(OUTPUT_STREAM);
        for (Expression arg : node.getArgs()) {
            result.append(" << ").append(translate(arg));
        }

        Map<String, Expression> keywords = node.getKeywords();
        Expression end = keywords.get("end");
        if (end == null) {
            result.append(" << ").append(LINE_END);
        } else if (!isEmptyString(end)) {
            result.append(" << ").append(translate(end));
        }
        return result.toString();
    }

    private String inputCall(Call node) {
        String target = node.getArgs().isEmpty()
                ? options.getInputPlaceholder()
                : translate(node.getArgs().get(0));
        return INPUT_STREAM + " >> " + target;
    }

    // ========== HELPERS ==========

    private static String cppSymbol(BinaryOperator operator) {
        return operator.getCppSymbol() != null ? operator.getCppSymbol() : operator.getPythonSymbol();
    }

    private static boolean isAtomic(Expression expression) {
        return expression instanceof Name
                || (expression instanceof Literal && ((Literal) expression).getKind() == Literal.Kind.NUMBER);
    }

    private static boolean isEmptyString(Expression expression) {
        return expression instanceof Literal
                && ((Literal) expression).getKind() == Literal.Kind.STRING
                && ((Literal) expression).getValue().isEmpty();
    }

    /**
     * Double-quotes string content using C++ escapes.
     */
    static String quote(String content) {
        StringBuilder result = new StringBuilder(content.length() + 2).append('"');
        for (char c : content.toCharArray()) {
            switch (c) {
                case '"' -> result.append("\\\"");
                case '\\' -> result.append("\\\\");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                case '\0' -> result.append("\\0");
                default -> result.append(c);
            }
        }
        return result.append('"').toString();
    }

    // True when the first '(' closes at the last character, so "(a) + (b)" is not wrapped.
    static boolean isWrapped(String text) {
        if (text.length() < 2 || text.charAt(0) != '(' || text.charAt(text.length() - 1) != ')') {
            return false;
        }
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
