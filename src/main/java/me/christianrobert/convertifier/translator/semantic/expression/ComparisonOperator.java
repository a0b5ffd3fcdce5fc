package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * Comparison operators. Membership tests have no C++ equivalent (null C++ symbol).
 */
public enum ComparisonOperator {
    EQ("==", "=="),
    NOT_EQ("!=", "!="),
    LT("<", "<"),
    LT_E("<=", "<="),
    GT(">", ">"),
    GT_E(">=", ">="),
    IS("is", "=="),
    IS_NOT("is not", "!="),
    IN("in", null),
    NOT_IN("not in", null);

    private final String pythonSymbol;
    private final String cppSymbol;

    ComparisonOperator(String pythonSymbol, String cppSymbol) {
        this.pythonSymbol = pythonSymbol;
        this.cppSymbol = cppSymbol;
    }

    public String getPythonSymbol() {
        return pythonSymbol;
    }

    public String getCppSymbol() {
        return cppSymbol;
    }

    /**
     * Resolves an operator from its source spelling; whitespace between the words
     * of {@code is not} / {@code not in} is normalised.
     */
    public static ComparisonOperator fromPythonSymbol(String symbol) {
        String normalized = symbol == null ? "" : symbol.trim().replaceAll("\\s+", " ");
        for (ComparisonOperator operator : values()) {
            if (operator.pythonSymbol.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }
}
