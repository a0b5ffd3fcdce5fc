package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * Binary arithmetic and bitwise operators.
 *
 * <p>{@link #POW} and {@link #MAT_MULT} have no infix C++ spelling; the C++ side decides
 * how to render them.
 */
public enum BinaryOperator {
    ADD("+", "+"),
    SUB("-", "-"),
    MULT("*", "*"),
    DIV("/", "/"),
    FLOOR_DIV("//", "/"),
    MOD("%", "%"),
    POW("**", null),
    MAT_MULT("@", null),
    LSHIFT("<<", "<<"),
    RSHIFT(">>", ">>"),
    BIT_OR("|", "|"),
    BIT_XOR("^", "^"),
    BIT_AND("&", "&");

    private final String pythonSymbol;
    private final String cppSymbol;

    BinaryOperator(String pythonSymbol, String cppSymbol) {
        this.pythonSymbol = pythonSymbol;
        this.cppSymbol = cppSymbol;
    }

    public String getPythonSymbol() {
        return pythonSymbol;
    }

    /**
     * C++ infix spelling, or null when the operator has no infix equivalent.
     */
    public String getCppSymbol() {
        return cppSymbol;
    }

    public static BinaryOperator fromPythonSymbol(String symbol) {
        for (BinaryOperator operator : values()) {
            if (operator.pythonSymbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}
