package me.christianrobert.polyconv.ast;

public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MULT("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    POW("**"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^");

    private final String sourceSymbol;

    BinaryOperator(String sourceSymbol) {
        this.sourceSymbol = sourceSymbol;
    }

    public String getSourceSymbol() {
        return sourceSymbol;
    }
}
