package me.christianrobert.convertifier.translator.semantic.expression;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Function call: {@code func(args..., name=value...)}.
 *
 * <p>Keyword arguments keep their source order. Star arguments ({@code *xs},
 * {@code **kw}) arrive as {@link RawExpression} positional arguments.
 */
public class Call implements Expression {

    private final Expression func;
    private final List<Expression> args;
    private final Map<String, Expression> keywords;

    public Call(Expression func, List<Expression> args, Map<String, Expression> keywords) {
        if (func == null) {
            throw new IllegalArgumentException("Call target cannot be null");
        }
        this.func = func;
        this.args = args == null ? List.of() : List.copyOf(args);
        this.keywords = keywords == null ? Map.of() : new LinkedHashMap<>(keywords);
    }

    public Call(Expression func, List<Expression> args) {
        this(func, args, null);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    public Expression getFunc() {
        return func;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public Map<String, Expression> getKeywords() {
        return java.util.Collections.unmodifiableMap(keywords);
    }

    /**
     * Checks whether this is a call of the bare builtin {@code name(...)}.
     */
    public boolean isBuiltin(String name) {
        return func instanceof Name && ((Name) func).getId().equals(name);
    }

    @Override
    public String toString() {
        return "Call{func=" + func + ", args=" + args
                + (keywords.isEmpty() ? "" : ", keywords=" + keywords) + "}";
    }
}
