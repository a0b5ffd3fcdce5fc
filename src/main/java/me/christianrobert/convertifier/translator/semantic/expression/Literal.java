package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * A literal constant.
 *
 * <p>For {@link Kind#STRING} the value is the decoded string content (quotes, prefixes
 * and escapes of the Python literal already resolved); for the other kinds it is the
 * source spelling ({@code 42}, {@code 1.5e3}, {@code True}, {@code None}).
 */
public class Literal implements Expression {

    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        NONE
    }

    private final Kind kind;
    private final String value;

    public Literal(Kind kind, String value) {
        if (kind == null) {
            throw new IllegalArgumentException("Literal kind cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Literal value cannot be null");
        }
        this.kind = kind;
        this.value = value;
    }

    public static Literal number(String text) {
        return new Literal(Kind.NUMBER, text);
    }

    public static Literal string(String content) {
        return new Literal(Kind.STRING, content);
    }

    public static Literal bool(boolean value) {
        return new Literal(Kind.BOOLEAN, value ? "True" : "False");
    }

    public static Literal none() {
        return new Literal(Kind.NONE, "None");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "Literal{kind=" + kind + ", value=" + value + "}";
    }
}
