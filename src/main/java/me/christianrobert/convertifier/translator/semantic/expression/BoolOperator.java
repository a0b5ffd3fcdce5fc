package me.christianrobert.convertifier.translator.semantic.expression;

public enum BoolOperator {
    AND("and", "&&"),
    OR("or", "||");

    private final String pythonSymbol;
    private final String cppSymbol;

    BoolOperator(String pythonSymbol, String cppSymbol) {
        this.pythonSymbol = pythonSymbol;
        this.cppSymbol = cppSymbol;
    }

    public String getPythonSymbol() {
        return pythonSymbol;
    }

    public String getCppSymbol() {
        return cppSymbol;
    }
}
