package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.PyNode;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;

/**
 * One formal parameter of a function definition.
 */
public class Parameter implements PyNode {

    public enum Kind {
        REGULAR,
        VAR_POSITIONAL,
        VAR_KEYWORD
    }

    private final String name;
    private final Kind kind;
    private final Expression annotation;
    private final Expression defaultValue;

    public Parameter(String name, Kind kind, Expression annotation, Expression defaultValue) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Parameter name cannot be null or empty");
        }
        this.name = name;
        this.kind = kind == null ? Kind.REGULAR : kind;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
    }

    public Parameter(String name) {
        this(name, Kind.REGULAR, null, null);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Type annotation, or null.
     */
    public Expression getAnnotation() {
        return annotation;
    }

    public boolean hasAnnotation() {
        return annotation != null;
    }

    /**
     * Default value, or null.
     */
    public Expression getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return "Parameter{name=" + name
                + (kind != Kind.REGULAR ? ", kind=" + kind : "")
                + (annotation != null ? ", annotation=" + annotation : "")
                + (defaultValue != null ? ", default=" + defaultValue : "") + "}";
    }
}
