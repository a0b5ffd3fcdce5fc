package me.christianrobert.convertifier.translator.semantic.expression;

public enum UnaryOperator {
    UADD("+", "+"),
    USUB("-", "-"),
    NOT("not", "!"),
    INVERT("~", "~");

    private final String pythonSymbol;
    private final String cppSymbol;

    UnaryOperator(String pythonSymbol, String cppSymbol) {
        this.pythonSymbol = pythonSymbol;
        this.cppSymbol = cppSymbol;
    }

    public String getPythonSymbol() {
        return pythonSymbol;
    }

    public String getCppSymbol() {
        return cppSymbol;
    }

    public static UnaryOperator fromPythonSymbol(String symbol) {
        for (UnaryOperator operator : values()) {
            if (operator.pythonSymbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown unary operator: " + symbol);
    }
}
